package com.modelsync.cli;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.config.ConfigLoader;
import com.modelsync.core.config.ModelSyncConfig;
import com.modelsync.core.descriptor.DescriptorLoader;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.server.DiagramServer;
import com.modelsync.core.sync.InMemoryDocumentStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to convert a parsed model into a diagram snapshot.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Convert and print the snapshot as JSON
 * model-sync convert model.ast.json -d ecml.yaml
 *
 * # Lay the diagram out as a tree and write it to a file
 * model-sync convert model.ast.json -d ecml.yaml --layout tree -o model.diagram.json
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert an AST file (JSON or YAML) into a diagram snapshot",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(index = "0", description = "AST file (.json, .yaml or .yml)")
    private Path astFile;

    @Option(names = {"-d", "--descriptor"}, required = true, description = "Language descriptor YAML file")
    private Path descriptorFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: model-sync.yaml)")
    private Path configPath = Paths.get("model-sync.yaml");

    @Option(names = {"-s", "--source"}, description = "Source text the AST was parsed from")
    private Path sourceFile;

    @Option(names = {"-l", "--layout"}, description = "Layout algorithm: grid, tree, layered or force")
    private String layout;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Override
    public Integer call() {
        try {
            ModelSyncConfig config = ConfigLoader.load(configPath);
            LanguageDescriptor descriptor = DescriptorLoader.load(descriptorFile);
            AstNode root = CommandInputs.readAst(astFile);
            SourceDocument document = CommandInputs.document(astFile, sourceFile);

            InMemoryDocumentStore store = new InMemoryDocumentStore();
            store.put(document);
            try (DiagramServer server = new DiagramServer(config, store)) {
                server.registerLanguage(descriptor);
                server.createContext(document, root, descriptor.languageId());
                DiagramSnapshot snapshot = server.loadModel(document.uri(), null).join();
                if (layout != null) {
                    server.applyLayout(document.uri(), layout).join();
                }
                log.info("Converted {} into {} nodes and {} edges", astFile, snapshot.nodes().size(), snapshot.edges().size());
                CommandInputs.writeJson(snapshot, output);
            }
            return 0;
        } catch (Exception e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }
}
