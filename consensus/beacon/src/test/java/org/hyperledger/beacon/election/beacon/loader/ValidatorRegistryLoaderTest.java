package org.hyperledger.beacon.election.beacon.loader;

import static org.hyperledger.beacon.election.beacon.ChainDataFixtures.validatorsJson;
import static org.hyperledger.beacon.election.beacon.ChainDataFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.hyperledger.beacon.election.beacon.ChainDataFixtures;
import org.hyperledger.beacon.election.beacon.ValidatorFixtures;
import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Gwei;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidatorRegistryLoaderTest {

  @TempDir Path tempDir;

  private final List<Validator> registry =
      List.of(
          ValidatorFixtures.activeFromGenesis(0),
          ValidatorFixtures.validator(1, Epoch.of(5), Epoch.of(300)),
          ValidatorFixtures.validator(2, Epoch.FAR_FUTURE_EPOCH, Epoch.FAR_FUTURE_EPOCH));

  @Test
  @DisplayName("Loads the registry in position order")
  void loadsRegistry() {
    final Path file = write(tempDir.resolve("validators.json"), validatorsJson(registry));

    assertEquals(registry, ValidatorRegistryLoader.load(file));
  }

  @Test
  void readsFarFutureEpochAsUnsigned() {
    final List<Validator> loaded = ValidatorRegistryLoader.parse(validatorsJson(registry));

    assertEquals(Epoch.FAR_FUTURE_EPOCH, loaded.get(0).exitEpoch());
    assertEquals(Epoch.FAR_FUTURE_EPOCH, loaded.get(2).activationEpoch());
  }

  @Test
  void indexIsOptional() {
    final ObjectNode json = validatorsJson(registry);
    json.get("data").forEach(entry -> ((ObjectNode) entry).remove("index"));

    assertEquals(registry, ValidatorRegistryLoader.parse(json));
  }

  @Test
  @DisplayName("An index that disagrees with the entry's position is rejected")
  void rejectsIndexGap() {
    final ObjectNode json = validatorsJson(registry);
    ((ObjectNode) json.get("data").get(1)).put("index", "7");

    final ChainDataException e =
        assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
    assertTrue(e.getMessage().contains("position 1"), e.getMessage());
  }

  @Test
  void rejectsMissingField() {
    final ObjectNode json = validatorsJson(registry);
    validatorFields(json, 2).remove("exit_epoch");

    final ChainDataException e =
        assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
    assertTrue(e.getMessage().contains("exit_epoch"), e.getMessage());
  }

  @Test
  void rejectsNegativeBalance() {
    final ObjectNode json = validatorsJson(registry);
    validatorFields(json, 0).put("effective_balance", "-32000000000");

    assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
  }

  @Test
  void rejectsOversizedPubkey() {
    final ObjectNode json = validatorsJson(registry);
    validatorFields(json, 0).put("pubkey", "0x" + "aa".repeat(49));

    assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
  }

  @Test
  void rejectsExitBeforeActivation() {
    final ObjectNode json = validatorsJson(registry);
    validatorFields(json, 1).put("exit_epoch", "4");

    assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
  }

  @Test
  void rejectsMissingDataArray() {
    final ObjectNode json = ChainDataFixtures.MAPPER.createObjectNode();
    json.put("data", "none");

    assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.parse(json));
  }

  @Test
  void readsEmptyRegistry() {
    assertEquals(List.of(), ValidatorRegistryLoader.parse(validatorsJson(List.of())));
  }

  @Test
  void keepsEffectiveBalance() {
    final Validator loaded = ValidatorRegistryLoader.parse(validatorsJson(registry)).get(1);

    assertEquals(Gwei.of(32_000_000_000L), loaded.effectiveBalance());
  }

  @Test
  void failsOnMissingOrUnparsableFile() throws IOException {
    assertThrows(
        ChainDataException.class,
        () -> ValidatorRegistryLoader.load(tempDir.resolve("absent.json")));

    final Path garbage = Files.writeString(tempDir.resolve("garbage.json"), "{\"data\": [");
    assertThrows(ChainDataException.class, () -> ValidatorRegistryLoader.load(garbage));
  }

  private static ObjectNode validatorFields(final ObjectNode json, final int position) {
    return (ObjectNode) json.get("data").get(position).get("validator");
  }
}
