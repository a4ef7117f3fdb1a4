package com.flagship.token_ledger.config;

import com.flagship.token_ledger.ledger.Principal;
import com.flagship.token_ledger.ledger.TokenLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Ledger configuration.
 *
 * Configures:
 * - Token metadata (name, symbol, decimals)
 * - Initial supply, credited to the deployer at startup
 * - The deployer identity, which becomes the first owner
 */
@Configuration
@Slf4j
public class TokenLedgerConfig {

    @Value("${token.name:ICP Token}")
    private String tokenName;

    @Value("${token.symbol:ICPT}")
    private String tokenSymbol;

    @Value("${token.decimals:8}")
    private int tokenDecimals;

    @Value("${token.initial-supply:1000000000000000000}")
    private BigInteger initialSupply;

    @Value("${ledger.deployer}")
    private String deployer;

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenLedger tokenLedger(Clock ledgerClock) {
        Principal owner = Principal.of(deployer);
        TokenLedger ledger = new TokenLedger(tokenName, tokenSymbol, tokenDecimals, initialSupply, owner, ledgerClock);
        log.info("Ledger initialized: token={} ({}), decimals={}, initialSupply={}, owner={}",
                tokenName, tokenSymbol, tokenDecimals, initialSupply, owner);
        return ledger;
    }
}
