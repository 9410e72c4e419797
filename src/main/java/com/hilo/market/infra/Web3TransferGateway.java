package com.hilo.market.infra;

import com.hilo.market.domain.Addresses;
import com.hilo.market.domain.TransferFailedException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;

/**
 * Pays out in the chain's native currency from the market's hot wallet.
 */
@Slf4j
public class Web3TransferGateway implements TransferGateway {

    private static final String TRANSFER = "transfer";

    private final TransactionManager txManager;
    private final StaticGasProvider gasProvider;

    public Web3TransferGateway(String rpcUrl, String privateKey, long chainId, BigInteger gasPrice,
            BigInteger gasLimit) {
        this(createTxManager(rpcUrl, privateKey, chainId), new StaticGasProvider(gasPrice, gasLimit));
    }

    Web3TransferGateway(TransactionManager txManager, StaticGasProvider gasProvider) {
        this.txManager = txManager;
        this.gasProvider = gasProvider;
    }

    private static TransactionManager createTxManager(String rpcUrl, String privateKey, long chainId) {
        if (privateKey == null || privateKey.isEmpty()) {
            log.warn("No private key provided. Payouts will be REFUSED until one is configured.");
            return null;
        }
        Credentials credentials = Credentials.create(privateKey);
        log.info("Payout wallet loaded: {}", credentials.getAddress());
        Web3j web3j = Web3j.build(new HttpService(rpcUrl));
        return new RawTransactionManager(web3j, credentials, chainId);
    }

    @Override
    public void transfer(String recipient, BigInteger amount) {
        String to = Addresses.normalize(recipient);
        if (txManager == null) {
            throw new TransferFailedException(to, amount, "no payout wallet configured");
        }

        EthSendTransaction sent;
        try {
            log.info("[TRANSFER] Sending {} wei to {}", amount, to);
            sent = txManager.sendTransaction(
                    gasProvider.getGasPrice(TRANSFER),
                    gasProvider.getGasLimit(TRANSFER),
                    to,
                    "",
                    amount);
        } catch (Exception e) {
            log.error("[TRANSFER] Transaction to {} failed", to, e);
            throw new TransferFailedException(to, amount, e);
        }

        if (sent.hasError()) {
            throw new TransferFailedException(to, amount, sent.getError().getMessage());
        }
        log.info("[TRANSFER] Sent! Hash: {}", sent.getTransactionHash());
    }
}
