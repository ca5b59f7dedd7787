package construction.serial;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import construction.index.Index;
import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.Scalar;
import construction.tensor.AddedTensor;
import construction.tensor.CustomTensor;
import construction.tensor.DeltaTensor;
import construction.tensor.EpsilonGammaTensor;
import construction.tensor.EpsilonTensor;
import construction.tensor.GammaTensor;
import construction.tensor.Kind;
import construction.tensor.MultipliedTensor;
import construction.tensor.ScalarTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.SubstituteTensor;
import construction.tensor.TensorNode;
import construction.tensor.ZeroTensor;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TensorCodecTest {

  private static final Range SPACE = Range.of(1, 3);
  private static final Range SPACETIME = Range.of(0, 3);

  private static IndexList indices(String names) {
    return IndexList.parse(names, SPACE);
  }

  private static List<TensorNode> samples() {
    Index up = Index.of("a", SPACE).withContravariant(true);
    Index down = Index.of("b", SPACE);
    TensorNode gamma = new GammaTensor(indices("a b"));
    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    return List.of(
        new ZeroTensor(),
        new ScalarTensor(Scalar.of(1, 2)),
        new ScalarTensor(Scalar.variable("x", 3)),
        epsilon,
        new GammaTensor(IndexList.parse("m n", SPACETIME), 1, 3),
        new DeltaTensor(IndexList.of(up, down)),
        new EpsilonGammaTensor(1, 1, indices("a b c d e")),
        new CustomTensor("T", "T", indices("a b")),
        new ScaledTensor(gamma, Scalar.of(-3)),
        new AddedTensor(List.of(gamma, new ScaledTensor(gamma, Scalar.of(2))), indices("a b")),
        new MultipliedTensor(gamma, new CustomTensor("V", "V", indices("c"))),
        new SubstituteTensor(gamma, indices("b a")));
  }

  @Test
  void everyKindSurvivesARoundTrip() {
    for (TensorNode sample : samples()) {
      byte[] bytes = TensorCodec.encode(sample);
      TensorNode decoded = TensorCodec.decode(bytes);
      assertEquals(sample, decoded, sample.toString());
      assertEquals(sample.kind(), decoded.kind());
      assertArrayEquals(bytes, TensorCodec.encode(decoded), sample.toString());
    }
  }

  @Test
  void symbolicScalesSurviveARoundTrip() {
    Scalar scale = Scalar.variable("x").add(Scalar.variable("y").multiply(Scalar.of(2)));
    TensorNode scaled = new ScaledTensor(new GammaTensor(indices("a b")), scale);
    ScaledTensor decoded = (ScaledTensor) TensorCodec.decode(TensorCodec.encode(scaled));
    assertEquals(scale, decoded.scale());
  }

  @Test
  void namesAndCovarianceArePreserved() {
    Index up = Index.of("a", SPACE).withContravariant(true);
    TensorNode named =
        new GammaTensor(IndexList.of(up, Index.of("b", SPACE))).withName("g", "\\bar{g}");

    TensorNode decoded = TensorCodec.decode(TensorCodec.encode(named));

    assertEquals("g", decoded.name());
    assertEquals("\\bar{g}", decoded.printedText());
    assertTrue(decoded.indices().get(0).isContravariant());
    assertFalse(decoded.indices().get(1).isContravariant());
  }

  @Test
  void unknownTensorTagsDecodeAsCustomTensors() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeBytes("R;R;");
    out.writeInt(0);
    out.writeInt(999);
    out.flush();

    TensorNode decoded = TensorCodec.decode(bytes.toByteArray());

    assertEquals(Kind.CUSTOM, decoded.kind());
    assertEquals("R", decoded.name());
  }

  @Test
  void truncatedStreamIsRejected() {
    byte[] bytes = TensorCodec.encode(samples().get(9));
    byte[] truncated = Arrays.copyOf(bytes, bytes.length - 5);
    assertThrows(WrongFormatException.class, () -> TensorCodec.decode(truncated));
  }

  @Test
  void emptyStreamIsRejected() {
    assertThrows(WrongFormatException.class, () -> TensorCodec.decode(new byte[0]));
  }

  @Test
  void unknownScalarTagIsRejected() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeBytes(";;");
    out.writeInt(0);
    out.writeInt(Kind.SCALAR.tag());
    out.writeInt(77);
    out.flush();

    assertThrows(WrongFormatException.class, () -> TensorCodec.decode(bytes.toByteArray()));
  }

  @Test
  void invalidNodeIsRejected() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeBytes("epsilon;\\epsilon;");
    out.writeInt(1);
    out.writeUTF("a");
    out.writeUTF("a");
    out.writeInt(1);
    out.writeInt(3);
    out.writeBoolean(false);
    out.writeInt(0);
    out.writeInt(Kind.EPSILON.tag());
    out.flush();

    assertThrows(WrongFormatException.class, () -> TensorCodec.decode(bytes.toByteArray()));
  }
}
