package com.zust.backend.account.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.account.dto.SubscriptionRequest;
import com.zust.backend.account.dto.SubscriptionResponse;
import com.zust.backend.account.service.SubscriptionService;
import com.zust.backend.global.MessageResponse;
import com.zust.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/subscribe")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubscriptionResponse subscribe(@AuthenticationPrincipal AuthPrincipal principal,
                                          @Valid @RequestBody SubscriptionRequest request) {
        return subscriptionService.subscribe(principal, request);
    }

    // same body as POST
    @DeleteMapping
    public MessageResponse unsubscribe(@AuthenticationPrincipal AuthPrincipal principal,
                                       @Valid @RequestBody SubscriptionRequest request) {
        subscriptionService.unsubscribe(principal, request);
        return MessageResponse.of("Unsubscription successfully");
    }
}
