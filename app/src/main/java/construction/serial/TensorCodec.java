package construction.serial;

import construction.index.Index;
import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.AddedScalar;
import construction.scalar.Fraction;
import construction.scalar.MultipliedScalar;
import construction.scalar.Scalar;
import construction.scalar.Variable;
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
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary form of tensor expressions.
 *
 * <p>Every node is written as {@code name ';' printedText ';'}, its index list, the kind tag and a
 * kind-specific payload. Composite nodes embed their children in full. Readers return {@code
 * null} when a node cannot be rebuilt and composite readers pass that on, so only {@link
 * #decode(InputStream)} decides how a malformed stream is reported.
 */
public final class TensorCodec {
  private static final Logger LOG = LoggerFactory.getLogger(TensorCodec.class);

  private static final byte SEPARATOR = ';';

  private TensorCodec() {}

  public static byte[] encode(TensorNode tensor) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      encode(tensor, bytes);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  public static void encode(TensorNode tensor, OutputStream out) throws IOException {
    DataOutputStream data = new DataOutputStream(out);
    writeTensor(tensor, data);
    data.flush();
  }

  public static TensorNode decode(byte[] bytes) {
    return decode(new ByteArrayInputStream(bytes));
  }

  /**
   * Reads one expression.
   *
   * @throws WrongFormatException if the stream is truncated or holds something else
   */
  public static TensorNode decode(InputStream in) {
    TensorNode tensor;
    try {
      tensor = readTensor(new DataInputStream(in));
    } catch (IOException | IllegalArgumentException | ArithmeticException e) {
      LOG.warn("Cannot decode tensor: {}", e.getMessage());
      throw new WrongFormatException("Malformed tensor stream: " + e.getMessage(), e);
    }
    if (tensor == null) {
      LOG.warn("Cannot decode tensor: unknown node in stream");
      throw new WrongFormatException();
    }
    return tensor;
  }

  private static void writeTensor(TensorNode tensor, DataOutputStream out) throws IOException {
    out.write(tensor.name().getBytes(StandardCharsets.UTF_8));
    out.writeByte(SEPARATOR);
    out.write(tensor.printedText().getBytes(StandardCharsets.UTF_8));
    out.writeByte(SEPARATOR);
    writeIndices(tensor.indices(), out);
    out.writeInt(tensor.kind().tag());

    if (tensor instanceof AddedTensor sum) {
      out.writeLong(sum.size());
      for (TensorNode summand : sum.summands()) {
        writeTensor(summand, out);
      }
    } else if (tensor instanceof MultipliedTensor product) {
      writeTensor(product.first(), out);
      writeTensor(product.second(), out);
    } else if (tensor instanceof ScaledTensor scaled) {
      writeScalar(scaled.scale(), out);
      writeTensor(scaled.tensor(), out);
    } else if (tensor instanceof SubstituteTensor substitute) {
      writeTensor(substitute.tensor(), out);
    } else if (tensor instanceof ScalarTensor scalar) {
      writeScalar(scalar.value(), out);
    } else if (tensor instanceof GammaTensor gamma) {
      out.writeInt(gamma.p());
      out.writeInt(gamma.q());
    } else if (tensor instanceof EpsilonGammaTensor epsilonGamma) {
      out.writeInt(epsilonGamma.numEpsilon());
      out.writeInt(epsilonGamma.numGamma());
    }
  }

  private static TensorNode readTensor(DataInputStream in) throws IOException {
    String name = readField(in);
    String printedText = readField(in);
    IndexList indices = readIndices(in);
    Kind kind = Kind.fromTag(in.readInt());

    TensorNode tensor =
        switch (kind) {
          case ADDITION -> readSum(indices, in);
          case MULTIPLICATION -> readProduct(in);
          case SCALED -> readScaled(in);
          case ZERO -> new ZeroTensor(indices);
          case SCALAR -> {
            Scalar value = readScalar(in);
            yield value == null ? null : new ScalarTensor(value);
          }
          case EPSILON -> new EpsilonTensor(indices);
          case GAMMA -> new GammaTensor(indices, in.readInt(), in.readInt());
          case EPSILON_GAMMA -> new EpsilonGammaTensor(in.readInt(), in.readInt(), indices);
          case DELTA -> new DeltaTensor(indices);
          case SUBSTITUTE -> {
            TensorNode child = readTensor(in);
            yield child == null ? null : new SubstituteTensor(child, indices);
          }
          case CUSTOM -> new CustomTensor(name, printedText, indices);
        };
    return tensor == null ? null : tensor.withName(name, printedText);
  }

  private static TensorNode readSum(IndexList indices, DataInputStream in) throws IOException {
    long count = in.readLong();
    if (count < 0 || count > Integer.MAX_VALUE) {
      return null;
    }
    List<TensorNode> summands = new ArrayList<>();
    for (long i = 0; i < count; i++) {
      TensorNode summand = readTensor(in);
      if (summand == null) {
        return null;
      }
      summands.add(summand);
    }
    return new AddedTensor(summands, indices);
  }

  private static TensorNode readProduct(DataInputStream in) throws IOException {
    TensorNode first = readTensor(in);
    if (first == null) {
      return null;
    }
    TensorNode second = readTensor(in);
    if (second == null) {
      return null;
    }
    return new MultipliedTensor(first, second);
  }

  private static TensorNode readScaled(DataInputStream in) throws IOException {
    Scalar scale = readScalar(in);
    if (scale == null) {
      return null;
    }
    TensorNode child = readTensor(in);
    return child == null ? null : new ScaledTensor(child, scale);
  }

  private static String readField(DataInputStream in) throws IOException {
    ByteArrayOutputStream field = new ByteArrayOutputStream();
    byte next;
    while ((next = in.readByte()) != SEPARATOR) {
      field.write(next);
    }
    return field.toString(StandardCharsets.UTF_8);
  }

  private static void writeIndices(IndexList indices, DataOutputStream out) throws IOException {
    out.writeInt(indices.size());
    for (Index index : indices) {
      out.writeUTF(index.name());
      out.writeUTF(index.printable());
      out.writeInt(index.range().from());
      out.writeInt(index.range().to());
      out.writeBoolean(index.isContravariant());
      out.writeInt(index.order());
    }
  }

  private static IndexList readIndices(DataInputStream in) throws IOException {
    int size = in.readInt();
    if (size < 0) {
      throw new IOException("Negative index count " + size);
    }
    List<Index> indices = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      String name = in.readUTF();
      String printable = in.readUTF();
      Range range = Range.of(in.readInt(), in.readInt());
      boolean contravariant = in.readBoolean();
      indices.add(new Index(name, printable, range, contravariant, in.readInt()));
    }
    return IndexList.of(indices);
  }

  private static void writeScalar(Scalar scalar, DataOutputStream out) throws IOException {
    out.writeInt(scalar.kind().tag());
    if (scalar instanceof Fraction fraction) {
      out.writeLong(fraction.numerator());
      out.writeLong(fraction.denominator());
    } else if (scalar instanceof Variable variable) {
      out.writeUTF(variable.name());
      out.writeInt(variable.id());
    } else if (scalar instanceof AddedScalar sum) {
      out.writeInt(sum.terms().size());
      for (Scalar term : sum.terms()) {
        writeScalar(term, out);
      }
    } else if (scalar instanceof MultipliedScalar product) {
      writeScalar(product.first(), out);
      writeScalar(product.second(), out);
    }
  }

  private static Scalar readScalar(DataInputStream in) throws IOException {
    Scalar.Kind kind = Scalar.Kind.fromTag(in.readInt());
    if (kind == null) {
      return null;
    }
    return switch (kind) {
      case FRACTION -> Fraction.of(in.readLong(), in.readLong());
      case VARIABLE -> Scalar.variable(in.readUTF(), in.readInt());
      case ADDED -> readScalarSum(in);
      case MULTIPLIED -> readScalarProduct(in);
    };
  }

  private static Scalar readScalarSum(DataInputStream in) throws IOException {
    int count = in.readInt();
    if (count <= 0) {
      return null;
    }
    Scalar result = null;
    for (int i = 0; i < count; i++) {
      Scalar term = readScalar(in);
      if (term == null) {
        return null;
      }
      result = result == null ? term : result.add(term);
    }
    return result;
  }

  private static Scalar readScalarProduct(DataInputStream in) throws IOException {
    Scalar first = readScalar(in);
    if (first == null) {
      return null;
    }
    Scalar second = readScalar(in);
    return second == null ? null : first.multiply(second);
  }
}
