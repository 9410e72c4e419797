package com.hilo.market.infra;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "market")
public record MarketProperties(
    /**
     * Owner address: pause, configuration, rescue.
     */
    @NotBlank String owner,
    /**
     * Keeper address allowed to settle rounds.
     */
    @NotBlank String keeper,
    /**
     * Protocol fee recipient.
     */
    @NotBlank String treasury,
    /**
     * Baseline of round 1, fixed-point with 2 implied decimals.
     */
    @NotNull Long initialBaseline,
    @NotNull @Positive BigInteger minBet,
    /**
     * 0 = unlimited.
     */
    @PositiveOrZero BigInteger maxBet,
    @NotNull Duration settlementInterval,
    @NotNull Duration bettingCutoff,
    @NotNull @PositiveOrZero @Max(10_000) Integer feeBps,
    @NotNull Long outcomeMin,
    @NotNull Long outcomeMax,
    /**
     * How long after settlement a round can still be claimed. Zero keeps claims open forever.
     */
    Duration claimWindow,
    @Valid Transfer transfer,
    @Valid Keeper keeperLoop,
    @Valid Oracle oracle
) {
  public MarketProperties {
    if (maxBet == null) {
      maxBet = BigInteger.ZERO;
    }
    if (claimWindow == null) {
      claimWindow = Duration.ZERO;
    }
    if (transfer == null) {
      transfer = new Transfer(null, null, null, null, null);
    }
    if (keeperLoop == null) {
      keeperLoop = new Keeper(null, null);
    }
    if (oracle == null) {
      oracle = new Oracle(null, null);
    }
  }

  public record Transfer(
      /**
       * "ledger" credits an in-memory balance book, "web3" sends native value on chain.
       */
      String mode,
      String rpcUrl,
      @Positive Long chainId,
      @Positive BigInteger gasPrice,
      @Positive BigInteger gasLimit
  ) {
    public Transfer {
      if (mode == null) {
        mode = "ledger";
      }
      if (rpcUrl == null) {
        rpcUrl = "http://localhost:8545";
      }
      if (chainId == null) {
        chainId = 1L;
      }
      if (gasPrice == null) {
        gasPrice = BigInteger.valueOf(30_000_000_000L); // 30 gwei
      }
      if (gasLimit == null) {
        gasLimit = BigInteger.valueOf(21_000);
      }
    }
  }

  public record Keeper(
      Boolean enabled,
      Long pollIntervalMillis
  ) {
    public Keeper {
      if (enabled == null) {
        enabled = false;
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 15_000L;
      }
    }
  }

  public record Oracle(
      String url,
      /**
       * Dot-separated path of the outcome field in the JSON response.
       */
      String fieldPath
  ) {
    public Oracle {
      if (fieldPath == null) {
        fieldPath = "value";
      }
    }
  }
}
