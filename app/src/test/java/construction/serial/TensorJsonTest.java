package construction.serial;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.Scalar;
import construction.tensor.Arithmetic;
import construction.tensor.EpsilonGammaTensor;
import construction.tensor.GammaTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.TensorNode;
import org.junit.jupiter.api.Test;

final class TensorJsonTest {

  private static final Range SPACE = Range.of(1, 3);

  @Test
  void sumsListTheirSummands() {
    TensorNode gamma = new GammaTensor(IndexList.parse("a b", SPACE));
    TensorNode sum = Arithmetic.add(gamma, new ScaledTensor(gamma, Scalar.of(-1, 2)));

    JsonObject json = JsonParser.parseString(TensorJson.toJson(sum)).getAsJsonObject();

    assertEquals("Addition", json.get("kind").getAsString());
    JsonArray summands = json.getAsJsonArray("summands");
    assertEquals(2, summands.size());
    JsonObject first = summands.get(0).getAsJsonObject();
    assertEquals("Gamma", first.get("kind").getAsString());
    assertEquals("gamma", first.get("name").getAsString());
    assertEquals(3, first.getAsJsonArray("signature").get(1).getAsInt());
    JsonObject second = summands.get(1).getAsJsonObject();
    assertEquals("Scaled", second.get("kind").getAsString());
    assertEquals(Scalar.of(-1, 2).toString(), second.get("scale").getAsString());
  }

  @Test
  void indicesCarryRangeAndCovariance() {
    IndexList indices = IndexList.parse("a b c", SPACE);
    TensorNode tensor = new EpsilonGammaTensor(1, 0, indices);

    JsonObject json = JsonParser.parseString(TensorJson.toJson(tensor)).getAsJsonObject();

    JsonArray jsonIndices = json.getAsJsonArray("indices");
    assertEquals(3, jsonIndices.size());
    JsonObject a = jsonIndices.get(0).getAsJsonObject();
    assertEquals("a", a.get("name").getAsString());
    assertEquals(1, a.getAsJsonArray("range").get(0).getAsInt());
    assertFalse(a.get("contravariant").getAsBoolean());
    assertEquals(1, json.get("epsilons").getAsInt());
    assertEquals(0, json.get("gammas").getAsInt());
  }

  @Test
  void outputIsPrettyPrinted() {
    String json = TensorJson.toJson(new GammaTensor(IndexList.parse("a b", SPACE)));
    assertTrue(json.contains("\n  \"kind\": \"Gamma\""));
  }
}
