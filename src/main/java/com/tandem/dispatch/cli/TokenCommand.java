package com.tandem.dispatch.cli;

import com.tandem.core.security.JwtTokenService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: tandem token --user &lt;id&gt;
 * <p>
 * Signs a bearer token with the configured secret, for local development against a
 * running server.
 */
@Command(name = "token", mixinStandardHelpOptions = true, description = "Issue a development bearer token")
@Component
public class TokenCommand implements Runnable {

    @Option(names = {"--user", "-u"}, required = true, description = "User id to put in the token subject")
    private long userId;

    @Option(names = {"--name"}, description = "Display name claim")
    private String name;

    private final JwtTokenService tokenService;

    public TokenCommand(JwtTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public void run() {
        System.out.println(tokenService.generateToken(userId, name));
    }
}
