package org.hyperledger.beacon.election.beacon.loader;

import static org.hyperledger.beacon.election.beacon.loader.JsonNodes.array;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

/**
 * Reads committees in the shape returned by the beacon API's {@code
 * /eth/v1/beacon/states/{state_id}/committees} endpoint. Committees are returned ordered by slot
 * then committee index.
 */
public final class CommitteeDataLoader {

  private static final Comparator<BeaconCommittee> CANONICAL_ORDER =
      Comparator.comparing(BeaconCommittee::slot).thenComparing(BeaconCommittee::index);

  private CommitteeDataLoader() {}

  public static List<BeaconCommittee> load(final Path file) {
    try {
      return parse(JsonNodes.read(file));
    } catch (ChainDataException e) {
      throw new ChainDataException("Malformed committees in " + file + ": " + e.getMessage(), e);
    }
  }

  public static List<BeaconCommittee> parse(final JsonNode root) {
    final JsonNode data = array(root, "data");
    final List<BeaconCommittee> committees = new ArrayList<>(data.size());
    for (final JsonNode entry : data) {
      final Slot slot = JsonNodes.parse(entry, "slot", Slot::fromString);
      final CommitteeIndex index = JsonNodes.parse(entry, "index", CommitteeIndex::fromString);
      final List<ValidatorIndex> validators = new ArrayList<>();
      for (final JsonNode validator : array(entry, "validators")) {
        try {
          validators.add(ValidatorIndex.fromString(validator.asText()));
        } catch (IllegalArgumentException | ArithmeticException e) {
          throw new ChainDataException(
              String.format(
                  "Invalid validator index '%s' in committee %s of slot %s",
                  validator.asText(), index, slot),
              e);
        }
      }
      committees.add(new BeaconCommittee(slot, index, validators));
    }
    committees.sort(CANONICAL_ORDER);
    return committees;
  }
}
