package com.batchjob.generator.codegen;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.InputUnavailableException;
import com.batchjob.generator.codegen.exception.OutputUnavailableException;
import com.batchjob.generator.codegen.model.core.context.GeneratorConfig;
import com.batchjob.generator.codegen.util.FileWriteUtil;

import lombok.Value;

/**
 * Generates one job script from a job description file.
 *
 * The script is assembled in memory and only written once complete, so a failed run
 * leaves no destination file behind.
 */
public class JobGenerator {
    private static final Logger log = LoggerFactory.getLogger(JobGenerator.class);

    private final GeneratorConfig config;
    private final ScriptAssembler assembler;

    public JobGenerator(GeneratorConfig config) {
        this(config, new ScriptAssembler());
    }

    public JobGenerator(GeneratorConfig config, ScriptAssembler assembler) {
        this.config = config;
        this.assembler = assembler;
    }

    public GeneratorResult generate() {
        try {
            log.info("Generating {} -> {}", config.getInputPath(), config.getOutputPath());

            Decoded decoded = assembleWithFallback();
            AssembledScript script = decoded.getScript();

            writeScript(script);

            log.info("Job {} generated: {} phases, {} commands",
                    script.getHeader().getJobFileName(),
                    script.getStats().getPhasesGenerated(),
                    script.getStats().getCommandsProcessed());

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputPath())
                    .jobName(script.getHeader().getJobFileName())
                    .phasesGenerated(script.getStats().getPhasesGenerated())
                    .commandsProcessed(script.getStats().getCommandsProcessed())
                    .errors(script.getStats().getErrors())
                    .scriptLines(script.getLineCount())
                    .inputCharset(decoded.getCharset())
                    .build();

        } catch (GenerationException e) {
            log.error("Generation failed: {}", e.describe());
            return GeneratorResult.failure(e.getKind(), e.describe());
        }
    }

    private Decoded assembleWithFallback() throws GenerationException {
        Path input = config.getInputPath();
        if (input == null || !Files.isRegularFile(input)) {
            throw new InputUnavailableException("Source file not found", config.getSourceName(), null);
        }

        try {
            return new Decoded(assemble(input, config.getInputCharset()), config.getInputCharset());
        } catch (InputUnavailableException e) {
            if (!(e.getCause() instanceof CharacterCodingException)
                    || config.getFallbackCharset().equals(config.getInputCharset())) {
                throw e;
            }
            log.info("{} is not valid {}, retrying with {}",
                    input, config.getInputCharset(), config.getFallbackCharset());
            return new Decoded(assemble(input, config.getFallbackCharset()), config.getFallbackCharset());
        }
    }

    private AssembledScript assemble(Path input, Charset charset) throws GenerationException {
        try (Reader reader = Files.newBufferedReader(input, charset)) {
            return assembler.assemble(reader, config);
        } catch (IOException e) {
            throw new InputUnavailableException("Unable to open source: " + e.getMessage(), config.getSourceName(), e);
        }
    }

    private void writeScript(AssembledScript script) throws OutputUnavailableException {
        Path output = config.getOutputPath();
        if (output == null) {
            throw new OutputUnavailableException("No destination configured", config.getSourceName(), null);
        }
        if (Files.exists(output) && !config.isForce()) {
            throw new OutputUnavailableException("Destination already exists: " + output, config.getSourceName(), null);
        }
        try {
            FileWriteUtil.writeAtomically(output, script.getContent(), config.getOutputCharset());
        } catch (IOException e) {
            throw new OutputUnavailableException(
                    "Unable to write " + output + ": " + e.getMessage(), config.getSourceName(), e);
        }
    }

    @Value
    private static class Decoded {
        AssembledScript script;
        Charset charset;
    }
}
