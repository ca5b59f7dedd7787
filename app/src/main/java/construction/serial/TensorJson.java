package construction.serial;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import construction.index.Index;
import construction.tensor.AddedTensor;
import construction.tensor.EpsilonGammaTensor;
import construction.tensor.GammaTensor;
import construction.tensor.MultipliedTensor;
import construction.tensor.ScalarTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.SubstituteTensor;
import construction.tensor.TensorNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Pretty-printed JSON dump of an expression tree, for inspection and reports. */
public final class TensorJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private TensorJson() {}

  public static String toJson(TensorNode tensor) {
    return GSON.toJson(node(tensor));
  }

  private static Map<String, Object> node(TensorNode tensor) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", tensor.kind().label());
    if (!tensor.name().isEmpty()) {
      map.put("name", tensor.name());
    }
    map.put("indices", indices(tensor));

    if (tensor instanceof AddedTensor sum) {
      List<Map<String, Object>> summands = new ArrayList<>();
      for (TensorNode summand : sum.summands()) {
        summands.add(node(summand));
      }
      map.put("summands", summands);
    } else if (tensor instanceof MultipliedTensor product) {
      map.put("factors", List.of(node(product.first()), node(product.second())));
    } else if (tensor instanceof ScaledTensor scaled) {
      map.put("scale", scaled.scale().toString());
      map.put("tensor", node(scaled.tensor()));
    } else if (tensor instanceof SubstituteTensor substitute) {
      map.put("tensor", node(substitute.tensor()));
    } else if (tensor instanceof ScalarTensor scalar) {
      map.put("value", scalar.value().toString());
    } else if (tensor instanceof GammaTensor gamma) {
      map.put("signature", List.of(gamma.p(), gamma.q()));
    } else if (tensor instanceof EpsilonGammaTensor epsilonGamma) {
      map.put("epsilons", epsilonGamma.numEpsilon());
      map.put("gammas", epsilonGamma.numGamma());
    }
    return map;
  }

  private static List<Map<String, Object>> indices(TensorNode tensor) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (Index index : tensor.indices()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("name", index.name());
      map.put("range", List.of(index.range().from(), index.range().to()));
      map.put("contravariant", index.isContravariant());
      list.add(map);
    }
    return list;
  }
}
