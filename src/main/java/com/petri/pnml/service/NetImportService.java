package com.petri.pnml.service;

import com.petri.pnml.domain.PetriNet;
import com.petri.pnml.parser.PnmlDocumentLoader;
import com.petri.pnml.parser.PnmlParseException;
import com.petri.pnml.parser.PnmlParser;
import com.petri.pnml.report.NetReport;
import com.petri.pnml.repository.NetJdbcRepository;
import com.petri.pnml.validation.PetriNetValidator;
import com.petri.pnml.validation.ValidationModels.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

@Service
public class NetImportService {
    private static final Logger log = LoggerFactory.getLogger(NetImportService.class);

    private final PnmlDocumentLoader loader;
    private final PnmlParser parser;
    private final PetriNetValidator validator;
    private final NetJdbcRepository repository;

    public NetImportService(PnmlDocumentLoader loader,
                            PnmlParser parser,
                            PetriNetValidator validator,
                            NetJdbcRepository repository) {
        this.loader = loader;
        this.parser = parser;
        this.validator = validator;
        this.repository = repository;
    }

    public ImportResult importNet(String content, boolean dryRun) {
        PetriNet net;
        try {
            net = parser.parse(loader.load(content));
        } catch (PnmlParseException e) {
            log.warn("Rejected PNML document [{}]: {}", e.code(), e.getMessage());
            throw e;
        }

        ValidationResult result = validator.validate(net);
        NetReport report = NetReport.of(net, result);

        String netId = null;
        if (!dryRun) {
            netId = UUID.randomUUID().toString();
            repository.save(netId, net);
        }
        log.info("Imported net {} (dryRun={}): {} errors, {} warnings",
                netId, dryRun, result.errors().size(), result.warnings().size());
        return new ImportResult(netId, dryRun, result.valid(), report);
    }

    public Optional<NetReport> report(String netId) {
        return repository.load(netId).map(net -> NetReport.of(net, validator.validate(net)));
    }

    public record ImportResult(String netId, boolean dryRun, boolean valid, NetReport report) {}
}
