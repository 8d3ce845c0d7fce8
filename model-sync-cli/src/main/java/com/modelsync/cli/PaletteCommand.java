package com.modelsync.cli;

import com.modelsync.core.descriptor.DescriptorLoader;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.server.provider.ToolPaletteProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print the tool palette a language descriptor yields.
 */
@Command(
    name = "palette",
    description = "Print the tool palette of a language descriptor as JSON",
    mixinStandardHelpOptions = true
)
public class PaletteCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PaletteCommand.class);

    @Parameters(index = "0", description = "Language descriptor YAML file")
    private Path descriptorFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Override
    public Integer call() {
        try {
            LanguageDescriptor descriptor = DescriptorLoader.load(descriptorFile);
            CommandInputs.writeJson(new ToolPaletteProvider().getToolPalette(descriptor), output);
            return 0;
        } catch (Exception e) {
            log.error("Could not build palette", e);
            System.err.println("✗ Could not build palette: " + e.getMessage());
            return 1;
        }
    }
}
