package com.chainpulse.ingestion.normalizer;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts wei quantities to native units: gas cost = gasUsed × gasPriceWei / 1e18.
 */
@Component
public class GasCostCalculator {

    private static final BigDecimal WEI_PER_ETH = new BigDecimal("1e18");
    private static final int SCALE = 18;

    /**
     * @return gas cost in native units, or zero if either argument is null or not positive
     */
    public BigDecimal gasCostEth(BigInteger gasUsed, BigInteger gasPriceWei) {
        if (gasUsed == null || gasUsed.signum() <= 0 || gasPriceWei == null || gasPriceWei.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return weiToEth(gasUsed.multiply(gasPriceWei));
    }

    public BigDecimal weiToEth(BigInteger wei) {
        if (wei == null || wei.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(wei).divide(WEI_PER_ETH, SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
