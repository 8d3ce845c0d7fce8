package com.modelsync.cli;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.config.ModelSyncConfig;
import com.modelsync.core.descriptor.DescriptorLoader;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.server.DiagramServer;
import com.modelsync.core.server.provider.DiagramMarker;
import com.modelsync.core.server.provider.DiagramValidator;
import com.modelsync.core.server.provider.ValidationReport;
import com.modelsync.core.sync.InMemoryDocumentStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to lint a language descriptor and, given an AST, validate the resulting diagram.
 *
 * <p>Exits with 1 when any error marker is found.
 */
@Command(
    name = "validate",
    description = "Lint a language descriptor and validate the diagram of an AST",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Language descriptor YAML file")
    private Path descriptorFile;

    @Option(names = {"-a", "--ast"}, description = "AST file to convert and validate")
    private Path astFile;

    @Option(names = {"--json"}, description = "Print the report as JSON")
    private boolean json;

    @Override
    public Integer call() {
        try {
            LanguageDescriptor descriptor = DescriptorLoader.load(descriptorFile);
            ValidationReport report = astFile != null
                ? validateDiagram(descriptor)
                : ValidationReport.of(new DiagramValidator().lintDescriptor(descriptor));

            if (json) {
                CommandInputs.writeJson(report, null);
            } else {
                printReport(report);
            }
            return report.valid() ? 0 : 1;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private ValidationReport validateDiagram(LanguageDescriptor descriptor) throws Exception {
        AstNode root = CommandInputs.readAst(astFile);
        SourceDocument document = CommandInputs.document(astFile, null);
        try (DiagramServer server = new DiagramServer(ModelSyncConfig.defaults(), new InMemoryDocumentStore())) {
            server.registerLanguage(descriptor);
            server.createContext(document, root, descriptor.languageId());
            server.loadModel(document.uri(), null).join();
            return server.validate(document.uri()).join();
        }
    }

    private void printReport(ValidationReport report) {
        for (DiagramMarker marker : report.markers()) {
            String element = marker.elementId() != null ? " [" + marker.elementId() + "]" : "";
            System.out.printf("%-7s %s%s: %s%n", marker.severity(), marker.code(), element, marker.message());
        }
        System.out.println();
        System.out.printf("%s %d errors, %d warnings%n", report.valid() ? "✓" : "✗", report.errorCount(), report.warningCount());
    }
}
