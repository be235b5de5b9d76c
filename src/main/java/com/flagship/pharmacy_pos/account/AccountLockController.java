package com.flagship.pharmacy_pos.account;

import com.flagship.pharmacy_pos.account.dto.AccountLockResponse;
import com.flagship.pharmacy_pos.account.dto.LockAccountRequest;
import com.flagship.pharmacy_pos.account.dto.UnlockAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Administrative lock and unlock. Failed logins are reported by the identity
 * subsystem through {@code login-failure}.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class AccountLockController {

    private final AccountLockService accountLockService;

    @PostMapping("/{userId}/login-failure")
    public ResponseEntity<AccountLockResponse> loginFailure(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(AccountLockResponse.from(accountLockService.recordLoginFailure(userId)));
    }

    @PostMapping("/{userId}/lock")
    public ResponseEntity<AccountLockResponse> lock(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody LockAccountRequest request) {
        return ResponseEntity.ok(AccountLockResponse.from(
            accountLockService.lockAccount(userId, request.getAdminId(), request.getReason())));
    }

    @PostMapping("/{userId}/unlock")
    public ResponseEntity<AccountLockResponse> unlock(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UnlockAccountRequest request) {
        return ResponseEntity.ok(AccountLockResponse.from(
            accountLockService.unlockAccount(userId, request.getAdminPin(), request.getReason())));
    }
}
