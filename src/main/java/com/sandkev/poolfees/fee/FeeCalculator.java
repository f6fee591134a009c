package com.sandkev.poolfees.fee;

import com.sandkev.poolfees.chain.ChainTransaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Computes a transaction fee in USD: gasPrice (wei) × gasUsed × nativePriceUsd / 1e18.
 */
@Component
public class FeeCalculator {

    private static final BigDecimal WEI_PER_ETH = new BigDecimal("1e18");

    public BigDecimal feeUsd(BigInteger gasPriceWei, BigInteger gasUsed, BigDecimal nativePriceUsd) {
        return new BigDecimal(gasPriceWei.multiply(gasUsed))
                .multiply(nativePriceUsd)
                .divide(WEI_PER_ETH, 18, RoundingMode.HALF_UP);
    }

    /**
     * Validates the transaction and prices it.
     *
     * @throws FeeDataException if the hash is null or a gas field is not an integer
     */
    public BigDecimal feeUsd(ChainTransaction tx, BigDecimal nativePriceUsd) {
        if (tx.hash() == null) {
            throw new FeeDataException("Transaction hash found to be null (block " + tx.blockNumber() + ")");
        }
        BigInteger gasPrice = parseInteger("gasPrice", tx.gasPrice(), tx.hash());
        BigInteger gasUsed = parseInteger("gasUsed", tx.gasUsed(), tx.hash());
        return feeUsd(gasPrice, gasUsed, nativePriceUsd);
    }

    private static BigInteger parseInteger(String field, String value, String hash) {
        if (value == null) {
            throw new FeeDataException(field + " missing for transaction " + hash);
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new FeeDataException(field + "='" + value + "' is not an integer for transaction " + hash, e);
        }
    }
}
