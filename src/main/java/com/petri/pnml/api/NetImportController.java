package com.petri.pnml.api;

import com.petri.pnml.parser.PnmlParseException;
import com.petri.pnml.report.NetReport;
import com.petri.pnml.service.NetImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/nets")
public class NetImportController {
    private final NetImportService importService;

    public NetImportController(NetImportService importService) {
        this.importService = importService;
    }

    @PostMapping("/import")
    public ResponseEntity<NetImportService.ImportResult> importNet(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importNet(request.content(), request.dryRun()));
    }

    @GetMapping("/{netId}/report")
    public ResponseEntity<NetReport> report(@PathVariable String netId) {
        return importService.report(netId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(PnmlParseException.class)
    public ResponseEntity<ParseFailure> parseFailure(PnmlParseException e) {
        return ResponseEntity.badRequest().body(new ParseFailure(e.code(), e.getMessage(), e.elementId()));
    }

    public record ImportRequest(String content, boolean dryRun) {}

    public record ParseFailure(String code, String message, String elementId) {}
}
