package com.zust.backend.auth.identity.verification.service;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import com.zust.backend.auth.config.AppMailProperties;
import com.zust.backend.auth.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * Mail adapter for the verification link. Keeps JavaMailSender out of the services.
 */
@Component
@RequiredArgsConstructor
public class VerificationMailSender {

    static final String VERIFICATION_PATH = "/auth/verification";

    private final JavaMailSender mailSender;
    private final AuthProperties authProps;
    private final AppMailProperties mailProps;

    public void sendVerificationLink(String toEmail, String username, String token) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setTo(toEmail);
        msg.setFrom(mailProps.from());
        msg.setSubject(mailProps.verificationSubject());
        msg.setText(buildBody(username, buildLink(token)));
        mailSender.send(msg);
    }

    String buildLink(String token) {
        return UriComponentsBuilder.fromHttpUrl(authProps.verification().linkBaseUrl())
                .path(VERIFICATION_PATH)
                .queryParam("token", token)
                .build()
                .toUriString();
    }

    private String buildBody(String username, String link) {
        long hours = Math.max(1, authProps.verification().ttlSeconds() / 3600);
        return "Hi " + username + ",\n\n"
                + "Please verify your Zust account by opening the link below:\n"
                + link + "\n\n"
                + "The link expires in " + hours + " hour(s).";
    }
}
