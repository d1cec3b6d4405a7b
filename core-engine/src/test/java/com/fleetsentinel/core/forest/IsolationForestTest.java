package com.fleetsentinel.core.forest;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForest}.
 */
class IsolationForestTest {

    private static final double[] CENTER = {20, 30};
    private static final double[] OUTLIER = {95, 92};

    private static List<double[]> training;
    private static IsolationForest forest;

    @BeforeAll
    static void train() {
        training = gaussianCloud(200, new Random(42));
        forest = IsolationForest.train(training, 100, 256, 0.1, new Random(7));
    }

    static List<double[]> gaussianCloud(int n, Random random) {
        List<double[]> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new double[]{20 + random.nextGaussian() * 2, 30 + random.nextGaussian() * 3});
        }
        return points;
    }

    @Test
    @DisplayName("Should use c(1) = 0, c(2) = 1 and the harmonic approximation above")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForest.averagePathLength(0)).isZero();
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);

        double expected = 2 * (Math.log(255) + 0.5772156649) - 2.0 * 255 / 256;
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Should score an isolated point higher than a point in the dense center")
    void shouldScoreOutlierHigher() {
        double outlierScore = forest.anomalyScore(OUTLIER);
        double centerScore = forest.anomalyScore(CENTER);

        assertThat(outlierScore).isGreaterThan(centerScore);
        assertThat(outlierScore).isGreaterThan(0.6);
        assertThat(outlierScore).isLessThanOrEqualTo(1.0);
        assertThat(centerScore).isLessThan(0.5);
    }

    @Test
    @DisplayName("Should predict the outlier as anomalous and the center as normal")
    void shouldPredict() {
        assertThat(forest.predict(OUTLIER)).isTrue();
        assertThat(forest.predict(CENTER)).isFalse();
    }

    @Test
    @DisplayName("Should place the cutoff so at most the contamination share of training points exceed it")
    void shouldDeriveCutoffFromContamination() {
        long above = training.stream().filter(forest::predict).count();

        // rank floor(200 * 0.1) - 1 = 19 in descending order
        assertThat(above).isLessThanOrEqualTo(19);
        List<Double> scores = new ArrayList<>();
        for (double[] p : training) {
            scores.add(forest.anomalyScore(p));
        }
        scores.sort(Collections.reverseOrder());
        assertThat(forest.getCutoff()).isEqualTo(scores.get(19));
    }

    @Test
    @DisplayName("Should cap the sub-sample size at the training set size")
    void shouldCapSubSampleSize() {
        IsolationForest small = IsolationForest.train(gaussianCloud(10, new Random(1)), 10, 256, 0.1, new Random(2));

        assertThat(small.getSubSampleSize()).isEqualTo(10);
        assertThat(forest.getSubSampleSize()).isEqualTo(200);
        assertThat(forest.getTreeCount()).isEqualTo(100);
        assertThat(forest.getDimensions()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not grow trees deeper than ceil(log2(sub-sample size))")
    void shouldLimitTreeDepth() {
        IsolationForest limited = IsolationForest.train(training, 20, 64, 0.1, new Random(3));

        assertThat(limited.maxTreeDepth()).isLessThanOrEqualTo(6);
    }

    @Test
    @DisplayName("Should be reproducible for the same seed")
    void shouldBeDeterministicForSeed() {
        IsolationForest a = IsolationForest.train(training, 30, 128, 0.1, new Random(99));
        IsolationForest b = IsolationForest.train(training, 30, 128, 0.1, new Random(99));

        assertThat(a.anomalyScore(OUTLIER)).isEqualTo(b.anomalyScore(OUTLIER));
        assertThat(a.getCutoff()).isEqualTo(b.getCutoff());
    }

    @Test
    @DisplayName("Should score every point 0.5 on constant training data")
    void shouldHandleConstantData() {
        List<double[]> constant = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            constant.add(new double[]{5, 5});
        }
        IsolationForest flat = IsolationForest.train(constant, 10, 256, 0.1, new Random(4));

        assertThat(flat.anomalyScore(new double[]{5, 5})).isCloseTo(0.5, within(1e-12));
        assertThat(flat.predict(new double[]{5, 5})).isFalse();
    }

    @Test
    @DisplayName("Should score 0 when trained on a single point")
    void shouldHandleSinglePoint() {
        IsolationForest single = IsolationForest.train(List.of(new double[]{1, 2}), 5, 256, 0.1, new Random(5));

        assertThat(single.anomalyScore(new double[]{100, 200})).isZero();
        assertThat(single.predict(new double[]{100, 200})).isFalse();
    }

    @Test
    @DisplayName("Should reject invalid training input")
    void shouldRejectInvalidInput() {
        Random random = new Random(6);
        assertThatThrownBy(() -> IsolationForest.train(List.of(), 10, 256, 0.1, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IsolationForest.train(training, 10, 256, 0.5, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IsolationForest.train(training, 0, 256, 0.1, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IsolationForest.train(
                List.of(new double[]{1, 2}, new double[]{1}), 10, 256, 0.1, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IsolationForest.train(
                List.of(new double[]{1, Double.NaN}), 10, 256, 0.1, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forest.anomalyScore(new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
