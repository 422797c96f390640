package com.zust.backend.account.web;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.account.service.AccountLockService;
import com.zust.backend.global.MessageResponse;
import com.zust.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/accounts")
public class AccountLockController {

    private final AccountLockService accountLockService;

    @PostMapping("/{id}/lock")
    @ResponseStatus(HttpStatus.CREATED)
    public MessageResponse lock(@AuthenticationPrincipal AuthPrincipal principal,
                                @PathVariable("id") UUID accountId) {
        accountLockService.lock(principal, accountId);
        return MessageResponse.of("Account with ID " + accountId + " locked successfully");
    }
}
