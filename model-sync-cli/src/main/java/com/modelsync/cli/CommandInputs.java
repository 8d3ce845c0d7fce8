package com.modelsync.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.modelsync.core.ast.AstJsonReader;
import com.modelsync.core.ast.AstNode;
import com.modelsync.core.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Input loading and output writing shared by the commands.
 */
final class CommandInputs {

    private static final Logger log = LoggerFactory.getLogger(CommandInputs.class);

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private CommandInputs() {
    }

    static AstNode readAst(Path astFile) throws IOException {
        log.debug("Reading AST from {}", astFile);
        return new AstJsonReader().read(astFile);
    }

    /**
     * Builds the document the AST was parsed from. Without a source file the text is empty.
     */
    static SourceDocument document(Path astFile, Path sourceFile) throws IOException {
        String text = sourceFile != null ? Files.readString(sourceFile, StandardCharsets.UTF_8) : "";
        Path uriPath = sourceFile != null ? sourceFile : astFile;
        return new SourceDocument(uriPath.toAbsolutePath().toUri().toString(), text, 1);
    }

    /**
     * Writes a value as indented JSON to a file, or to standard output when no file is given.
     */
    static void writeJson(Object value, Path output) throws IOException {
        String json = JSON.writeValueAsString(value);
        if (output == null) {
            System.out.println(json);
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, json + System.lineSeparator(), StandardCharsets.UTF_8);
        log.info("Wrote {}", output);
    }
}
