package com.batchjob.generator.codegen.phase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out phase numbers and the labels derived from them.
 *
 * The counter always holds the number of the next phase to open. Commands are scaffolded
 * against the phase opened last ({@link #previousPhase()}), and the intermediate label of a
 * two stage retry sits halfway between that phase and the next one.
 */
public class PhaseAllocator {

    public static final int PHASE_STEP = 10;
    public static final int INTERMEDIATE_OFFSET = 5;

    private int current;
    private final List<Integer> primaries = new ArrayList<>();
    private final Set<Integer> intermediates = new LinkedHashSet<>();

    public PhaseAllocator(int startPhase) {
        if (startPhase <= 0) {
            throw new IllegalArgumentException("Start phase must be positive: " + startPhase);
        }
        this.current = startPhase;
    }

    /**
     * Opens a new phase.
     *
     * @return the number of the phase just opened
     */
    public int openPhase() {
        int opened = current;
        primaries.add(opened);
        current += PHASE_STEP;
        return opened;
    }

    /**
     * Phase the emitted commands belong to: the one opened last.
     */
    public int previousPhase() {
        return current - PHASE_STEP;
    }

    public int current() {
        return current;
    }

    /**
     * Allocates the intermediate label between the previous phase and the next one.
     *
     * @throws IllegalStateException if the label would collide with a primary phase
     */
    public int intermediateLabel() {
        int label = current - INTERMEDIATE_OFFSET;
        if (primaries.contains(label)) {
            throw new IllegalStateException("Intermediate label " + label + " collides with a primary phase");
        }
        intermediates.add(label);
        return label;
    }

    /**
     * Whether the intermediate label of the current phase was already handed out.
     */
    public boolean isIntermediateIssued() {
        return intermediates.contains(current - INTERMEDIATE_OFFSET);
    }

    public List<Integer> getPrimaryPhases() {
        return Collections.unmodifiableList(primaries);
    }

    public Set<Integer> getIntermediateLabels() {
        return Collections.unmodifiableSet(intermediates);
    }
}
