package org.hyperledger.beacon.election.beacon.containers.beacon_blocks;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.types.UInt64;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

/**
 * The parts of a beacon block the election needs: the execution block number, the RANDAO value
 * exposed to the execution layer and the block's proposer.
 */
public record LightBlock(
    UInt64 blockNumber,
    Bytes32 prevRandao,
    ValidatorIndex proposerIndex
) {
}
