package com.zust.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.zust.backend.auth.config.AuthModuleConfig;

/*
Local run (MySQL + an SMTP catcher such as MailHog on 1025):

  APP_AUTH_JWT_SECRET=... APP_AUTH_VERIFICATION_SECRET=... \
  SPRING_DATASOURCE_URL=jdbc:mysql://localhost:3306/zust mvn -pl backend spring-boot:run

# register → verification mail
curl -i -X POST http://localhost:8080/auth/register -H "Content-Type: application/json" \
  -d '{"email":"anna@example.com","username":"anna","password":"s3cret!"}'

# login → {id, username, email, avatar, accessToken, refreshToken}
curl -i -X POST http://localhost:8080/auth/login -H "Content-Type: application/json" \
  -d '{"username":"anna","password":"s3cret!"}'

# refresh (refresh token as bearer), logout (access token as bearer)
curl -i -X POST http://localhost:8080/auth/token/refresh -H "Authorization: Bearer <refresh>"
curl -i -X POST http://localhost:8080/auth/logout -H "Authorization: Bearer <access>"
*/

/**
 * Boot entry point.
 *
 * UserDetailsServiceAutoConfiguration is excluded: authentication is bearer JWT only, there is
 * no in-memory user and no generated password in the log.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class ZustApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZustApplication.class, args);
    }
}
