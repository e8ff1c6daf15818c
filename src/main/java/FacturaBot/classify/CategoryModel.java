package FacturaBot.classify;

/**
 * Pretrained category model. Consumes the vector built by {@link CategoryFeatures}.
 */
public interface CategoryModel {

    CategoryPrediction predict(double[] features);
}
