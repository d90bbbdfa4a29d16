package com.chainpulse.ingestion.adapter;

import com.chainpulse.domain.ContractInteractions;

/**
 * Block-range data source for one contract: chain head plus transactions and logs touching the contract.
 * Implementations throw {@link RpcException} on transport failures.
 */
public interface ContractInteractionSource {

    boolean supports(String chain);

    long getCurrentBlockNumber(String chain);

    /**
     * Transactions and events of the contract in the inclusive block window.
     */
    ContractInteractions fetchContractInteractions(String contractAddress, long fromBlock, long toBlock, String chain);
}
