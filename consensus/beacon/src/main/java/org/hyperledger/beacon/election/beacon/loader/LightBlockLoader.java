package org.hyperledger.beacon.election.beacon.loader;

import static org.hyperledger.beacon.election.beacon.loader.JsonNodes.field;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.containers.beacon_blocks.LightBlock;
import org.hyperledger.beacon.election.beacon.types.UInt64;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

/**
 * Reads a block in the shape returned by the beacon API's {@code /eth/v2/beacon/blocks/{block_id}}
 * endpoint, keeping the execution block number, {@code prev_randao} and the proposer index.
 */
public final class LightBlockLoader {

  private LightBlockLoader() {}

  public static LightBlock load(final Path file) {
    try {
      return parse(JsonNodes.read(file));
    } catch (ChainDataException e) {
      throw new ChainDataException("Malformed block in " + file + ": " + e.getMessage(), e);
    }
  }

  public static LightBlock parse(final JsonNode root) {
    final JsonNode message = field(field(root, "data"), "message");
    final JsonNode payload = field(field(message, "body"), "execution_payload");
    return new LightBlock(
        JsonNodes.parse(payload, "block_number", UInt64::valueOf),
        JsonNodes.parse(payload, "prev_randao", Bytes32::fromHexString),
        JsonNodes.parse(message, "proposer_index", ValidatorIndex::fromString));
  }
}
