package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.terminal.dto.CloseTerminalRequest;
import com.flagship.pharmacy_pos.terminal.dto.DiagnosticsResponse;
import com.flagship.pharmacy_pos.terminal.dto.ForceCloseRequest;
import com.flagship.pharmacy_pos.terminal.dto.OpenAuthorizedRequest;
import com.flagship.pharmacy_pos.terminal.dto.OpenTerminalRequest;
import com.flagship.pharmacy_pos.terminal.dto.OpenTerminalResponse;
import com.flagship.pharmacy_pos.terminal.dto.RepairRequest;
import com.flagship.pharmacy_pos.terminal.dto.RepairResponse;
import com.flagship.pharmacy_pos.terminal.dto.SuggestedOpeningResponse;
import com.flagship.pharmacy_pos.terminal.dto.TerminalStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * REST surface for terminal sessions.
 *
 * Open answers 201 for a new session and 200 when the request matched the
 * caller's already open session.
 */
@RestController
@RequestMapping("/api/terminals")
@RequiredArgsConstructor
@Slf4j
public class TerminalController {

    private final TerminalSessionService sessionService;
    private final TerminalDiagnosticsService diagnosticsService;

    @PostMapping("/{terminalId}/open")
    public ResponseEntity<OpenTerminalResponse> open(
            @PathVariable("terminalId") UUID terminalId,
            @Valid @RequestBody OpenTerminalRequest request) {

        log.info("Open requested: terminalId={}, userId={}, openingAmount={}",
                terminalId, request.getUserId(), request.getOpeningAmount());

        OpenResult result = sessionService.openTerminal(terminalId, request.getUserId(), request.getOpeningAmount());
        return ResponseEntity.status(result.isExisting() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(OpenTerminalResponse.from(result));
    }

    @PostMapping("/{terminalId}/open-authorized")
    public ResponseEntity<OpenTerminalResponse> openAuthorized(
            @PathVariable("terminalId") UUID terminalId,
            @Valid @RequestBody OpenAuthorizedRequest request) {

        log.info("Authorized open requested: terminalId={}, userId={}, openingAmount={}",
                terminalId, request.getUserId(), request.getOpeningAmount());

        OpenResult result = sessionService.openTerminalAuthorized(terminalId, request.getUserId(),
                request.getOpeningAmount(), request.getSupervisorPin());
        return ResponseEntity.status(result.isExisting() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(OpenTerminalResponse.from(result));
    }

    @PostMapping("/{terminalId}/close")
    public ResponseEntity<Map<String, Object>> close(
            @PathVariable("terminalId") UUID terminalId,
            @Valid @RequestBody CloseTerminalRequest request) {

        sessionService.closeTerminal(terminalId, request.getUserId(), request.getFinalCash(),
                request.getWithdrawalAmount(), request.getComments());
        return ResponseEntity.ok(Map.of("terminal_id", terminalId, "status", TerminalStatus.CLOSED));
    }

    @PostMapping("/{terminalId}/force-close")
    public ResponseEntity<Map<String, Object>> forceClose(
            @PathVariable("terminalId") UUID terminalId,
            @Valid @RequestBody ForceCloseRequest request) {

        log.warn("Force close requested: terminalId={}, adminId={}", terminalId, request.getAdminId());

        sessionService.forceCloseTerminal(terminalId, request.getAdminId(), request.getJustification());
        return ResponseEntity.ok(Map.of("terminal_id", terminalId, "status", TerminalStatus.CLOSED));
    }

    @GetMapping("/{terminalId}/status")
    public ResponseEntity<TerminalStatusResponse> status(@PathVariable("terminalId") UUID terminalId) {
        return ResponseEntity.ok(TerminalStatusResponse.from(sessionService.getTerminalStatus(terminalId)));
    }

    @GetMapping("/{terminalId}/suggested-opening")
    public ResponseEntity<SuggestedOpeningResponse> suggestedOpening(@PathVariable("terminalId") UUID terminalId) {
        return ResponseEntity.ok(SuggestedOpeningResponse.from(sessionService.suggestOpeningAmount(terminalId)));
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<DiagnosticsResponse> diagnostics() {
        return ResponseEntity.ok(DiagnosticsResponse.from(diagnosticsService.diagnose()));
    }

    @PostMapping("/diagnostics/repair")
    public ResponseEntity<RepairResponse> repair(@Valid @RequestBody RepairRequest request) {
        return ResponseEntity.ok(RepairResponse.from(diagnosticsService.repair(request.getAdminId())));
    }
}
