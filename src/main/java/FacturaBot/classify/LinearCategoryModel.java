package FacturaBot.classify;

import FacturaBot.model.DocumentCategory;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/*
Modelo lineal (regresión logística multinomial) exportado como JSON.

Linear softmax model exported as JSON:

  {
    "features": ["pattern_domestic_fiscal", ...],
    "classes":  ["toll", "domestic_fiscal", ...],
    "weights":  [[...], ...],   one row per class
    "bias":     [...]
  }
*/
public final class LinearCategoryModel implements CategoryModel {

    private final List<DocumentCategory> classes;
    private final double[][] weights;
    private final double[] bias;

    LinearCategoryModel(List<DocumentCategory> classes, double[][] weights, double[] bias) {
        if (classes.isEmpty()) {
            throw new ModelLoadException("Model declares no classes");
        }
        if (weights.length != classes.size() || bias.length != classes.size()) {
            throw new ModelLoadException("Model has " + classes.size() + " classes but "
                    + weights.length + " weight rows and " + bias.length + " bias terms");
        }
        for (double[] row : weights) {
            if (row.length != CategoryFeatures.FEATURE_NAMES.size()) {
                throw new ModelLoadException("Weight row has " + row.length + " entries, expected "
                        + CategoryFeatures.FEATURE_NAMES.size());
            }
        }
        this.classes = List.copyOf(classes);
        this.weights = weights;
        this.bias = bias;
    }

    public static LinearCategoryModel load(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read model file " + path, e);
        }
        try {
            return fromJson(new JSONObject(content));
        } catch (JSONException e) {
            throw new ModelLoadException("Malformed model file " + path + ": " + e.getMessage(), e);
        }
    }

    static LinearCategoryModel fromJson(JSONObject obj) {
        List<String> features = strings(obj.getJSONArray("features"));
        if (!features.equals(CategoryFeatures.FEATURE_NAMES)) {
            throw new ModelLoadException("Model features " + features
                    + " do not match " + CategoryFeatures.FEATURE_NAMES);
        }

        List<DocumentCategory> classes = new ArrayList<>();
        for (String label : strings(obj.getJSONArray("classes"))) {
            classes.add(DocumentCategory.fromKey(label)
                    .orElseThrow(() -> new ModelLoadException("Unknown category in model: " + label)));
        }

        JSONArray rows = obj.getJSONArray("weights");
        double[][] weights = new double[rows.length()][];
        for (int i = 0; i < rows.length(); i++) {
            weights[i] = doubles(rows.getJSONArray(i));
        }
        return new LinearCategoryModel(classes, weights, doubles(obj.getJSONArray("bias")));
    }

    @Override
    public CategoryPrediction predict(double[] features) {
        if (features.length != CategoryFeatures.FEATURE_NAMES.size()) {
            throw new IllegalArgumentException("Expected " + CategoryFeatures.FEATURE_NAMES.size()
                    + " features, got " + features.length);
        }
        double[] scores = new double[classes.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < scores.length; c++) {
            double z = bias[c];
            for (int f = 0; f < features.length; f++) {
                z += weights[c][f] * features[f];
            }
            scores[c] = z;
            max = Math.max(max, z);
        }

        // softmax, shifted by the max for stability
        double sum = 0;
        for (int c = 0; c < scores.length; c++) {
            scores[c] = Math.exp(scores[c] - max);
            sum += scores[c];
        }
        int best = 0;
        for (int c = 1; c < scores.length; c++) {
            if (scores[c] > scores[best]) {
                best = c;
            }
        }
        return new CategoryPrediction(classes.get(best), scores[best] / sum);
    }

    public List<DocumentCategory> classes() {
        return classes;
    }

    private static List<String> strings(JSONArray array) {
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            out.add(array.getString(i));
        }
        return out;
    }

    private static double[] doubles(JSONArray array) {
        double[] out = new double[array.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = array.getDouble(i);
        }
        return out;
    }
}
