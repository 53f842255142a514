package org.hyperledger.beacon.election.beacon.loader;

import static org.hyperledger.beacon.election.beacon.loader.JsonNodes.array;
import static org.hyperledger.beacon.election.beacon.loader.JsonNodes.field;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.types.BLSPubKey;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Gwei;
import org.hyperledger.beacon.election.beacon.types.UInt64;

/**
 * Reads a validator registry in the shape returned by the beacon API's {@code
 * /eth/v1/beacon/states/{state_id}/validators} endpoint.
 *
 * <p>A validator's registry index is its position in the {@code data} array. Entries carrying an
 * explicit {@code index} must agree with their position. Any malformed entry fails the whole load.
 */
public final class ValidatorRegistryLoader {

  private static final Logger LOG = LogManager.getLogger(ValidatorRegistryLoader.class);

  private ValidatorRegistryLoader() {}

  public static List<Validator> load(final Path file) {
    final List<Validator> validators = parse(JsonNodes.read(file));
    LOG.info("Loaded {} validators from {}", validators.size(), file);
    return validators;
  }

  public static List<Validator> parse(final JsonNode root) {
    final JsonNode data = array(root, "data");
    final List<Validator> validators = new ArrayList<>(data.size());
    for (int position = 0; position < data.size(); position++) {
      final JsonNode entry = data.get(position);
      try {
        checkIndex(entry, position);
        validators.add(parseValidator(field(entry, "validator")));
      } catch (ChainDataException e) {
        throw new ChainDataException(
            "Malformed validator at position " + position + ": " + e.getMessage(), e);
      }
    }
    return List.copyOf(validators);
  }

  static Validator parseValidator(final JsonNode validator) {
    final BLSPubKey pubkey = JsonNodes.parse(validator, "pubkey", BLSPubKey::fromHexString);
    final Gwei effectiveBalance =
        JsonNodes.parse(validator, "effective_balance", Gwei::fromString);
    final Epoch activationEpoch =
        JsonNodes.parse(validator, "activation_epoch", Epoch::fromString);
    final Epoch exitEpoch = JsonNodes.parse(validator, "exit_epoch", Epoch::fromString);
    try {
      return new Validator(pubkey, effectiveBalance, activationEpoch, exitEpoch);
    } catch (IllegalArgumentException e) {
      throw new ChainDataException(e.getMessage(), e);
    }
  }

  private static void checkIndex(final JsonNode entry, final int position) {
    if (!entry.has("index")) {
      return;
    }
    final UInt64 index = JsonNodes.parse(entry, "index", UInt64::valueOf);
    if (!index.equals(UInt64.valueOf(position))) {
      throw new ChainDataException("Entry index " + index + " does not match its position");
    }
  }
}
