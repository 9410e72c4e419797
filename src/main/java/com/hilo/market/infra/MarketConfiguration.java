package com.hilo.market.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hilo.market.core.HiLoMarket;
import com.hilo.market.core.SettlementKeeper;
import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.MarketConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(MarketProperties.class)
public class MarketConfiguration {

    @Bean
    public Clock marketClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketConfig marketConfig(MarketProperties props) {
        MarketConfig config = MarketConfig.builder()
                .owner(Addresses.normalize(props.owner()))
                .keeper(Addresses.normalize(props.keeper()))
                .treasury(Addresses.normalize(props.treasury()))
                .minBet(props.minBet())
                .maxBet(props.maxBet())
                .settlementInterval(props.settlementInterval().getSeconds())
                .bettingCutoff(props.bettingCutoff().getSeconds())
                .feeBps(props.feeBps())
                .outcomeMin(props.outcomeMin())
                .outcomeMax(props.outcomeMax())
                .claimWindow(props.claimWindow().getSeconds())
                .build();
        config.validate();
        return config;
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.transfer", name = "mode", havingValue = "ledger", matchIfMissing = true)
    public InMemoryTransferGateway inMemoryTransferGateway() {
        log.info("Payouts credited to the in-memory balance book");
        return new InMemoryTransferGateway();
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.transfer", name = "mode", havingValue = "web3")
    public Web3TransferGateway web3TransferGateway(MarketProperties props,
            @Value("${app.private-key:}") String privateKey) {
        MarketProperties.Transfer transfer = props.transfer();
        log.info("Payouts sent on chain {} via {}", transfer.chainId(), transfer.rpcUrl());
        return new Web3TransferGateway(transfer.rpcUrl(), privateKey, transfer.chainId(),
                transfer.gasPrice(), transfer.gasLimit());
    }

    @Bean
    public HiLoMarket hiLoMarket(MarketConfig config, MarketProperties props, TransferGateway transferGateway,
            ApplicationEventPublisher events, Clock marketClock) {
        return new HiLoMarket(config, props.initialBaseline(), transferGateway, events, marketClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.oracle", name = "url")
    public OutcomeSource httpOutcomeSource(ObjectMapper objectMapper, MarketProperties props) {
        return new HttpOutcomeSource(objectMapper, props.oracle().url(), props.oracle().fieldPath());
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.keeper-loop", name = "enabled", havingValue = "true")
    public SettlementKeeper settlementKeeper(HiLoMarket market, OutcomeSource outcomeSource, MarketConfig config) {
        log.info("Keeper loop enabled for {}", config.getKeeper());
        return new SettlementKeeper(market, outcomeSource, config.getKeeper());
    }
}
