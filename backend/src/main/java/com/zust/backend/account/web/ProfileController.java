package com.zust.backend.account.web;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.account.dto.ProfileResponse;
import com.zust.backend.account.dto.ProfileUpdateRequest;
import com.zust.backend.account.service.ProfileService;
import com.zust.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

// GET is public (see SecurityConfig), PUT needs the account's own access token
@RestController
@RequiredArgsConstructor
@RequestMapping("/accounts")
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping("/{id}")
    public ProfileResponse get(@PathVariable("id") UUID accountId) {
        return profileService.get(accountId);
    }

    @PutMapping("/{id}")
    @ResponseStatus(HttpStatus.CREATED)
    public ProfileResponse update(@AuthenticationPrincipal AuthPrincipal principal,
                                  @PathVariable("id") UUID accountId,
                                  @Valid @RequestBody ProfileUpdateRequest request) {
        return profileService.update(principal, accountId, request);
    }
}
