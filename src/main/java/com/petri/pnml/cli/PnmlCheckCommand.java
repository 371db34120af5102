package com.petri.pnml.cli;

import com.petri.pnml.domain.PetriNet;
import com.petri.pnml.parser.PnmlDocumentLoader;
import com.petri.pnml.parser.PnmlParseException;
import com.petri.pnml.parser.PnmlParser;
import com.petri.pnml.report.NetReport;
import com.petri.pnml.report.ReportRenderer;
import com.petri.pnml.validation.PetriNetValidator;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "pnml-check",
        description = "Parse a PNML Petri net and report structural errors and marking warnings",
        version = "0.1.0",
        mixinStandardHelpOptions = true)
public final class PnmlCheckCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", arity = "1", paramLabel = "FILE", description = "PNML document to check")
    private Path file;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final PnmlDocumentLoader loader;
    private final PnmlParser parser;
    private final PetriNetValidator validator;

    public PnmlCheckCommand() {
        this(new PnmlDocumentLoader(), new PnmlParser(), new PetriNetValidator());
    }

    PnmlCheckCommand(PnmlDocumentLoader loader, PnmlParser parser, PetriNetValidator validator) {
        this.loader = loader;
        this.parser = parser;
        this.validator = validator;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PnmlCheckCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (!Files.isRegularFile(file)) {
            spec.commandLine().getErr().println("Error: File not found: " + file);
            return 1;
        }

        PetriNet net;
        try {
            net = parser.parse(loader.load(file));
        } catch (PnmlParseException e) {
            spec.commandLine().getErr().println("Parse error: " + e.getMessage());
            return 1;
        }

        NetReport report = NetReport.of(net, validator.validate(net));
        spec.commandLine().getOut().print(ReportRenderer.render(report));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
