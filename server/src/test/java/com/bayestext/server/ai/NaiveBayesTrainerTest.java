package com.bayestext.server.ai;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class NaiveBayesTrainerTest {

    @Test
    void testPriorsSumToOne() {
        int[][] labelSets = {
                { 0 },
                { 0, 1, 1, 0, 1 },
                { 3, 3, 3, 9, 12, 0, 9 },
                { 5, 5, 5, 5 }
        };
        for (int[] labels : labelSets) {
            SortedMap<Integer, Double> priors = NaiveBayesTrainer.estimateClassPriors(labels);
            double sum = 0.0;
            for (double prior : priors.values()) {
                assertTrue(prior > 0.0 && prior <= 1.0);
                sum += prior;
            }
            assertEquals(1.0, sum, 1e-12);
        }
    }

    @Test
    void testPriorsOnlyForObservedLabels() {
        SortedMap<Integer, Double> priors = NaiveBayesTrainer.estimateClassPriors(new int[] { 8, 2, 8, 8, 2 });
        assertEquals(2, priors.size());
        assertEquals(Integer.valueOf(2), priors.firstKey());
        assertEquals(0.4, priors.get(2), 1e-12);
        assertEquals(0.6, priors.get(8), 1e-12);
    }

    @Test
    void testEmptyLabelsFail() {
        assertThrows(IllegalArgumentException.class, () -> NaiveBayesTrainer.estimateClassPriors(new int[0]));
    }

    @Test
    void testWorkedExampleConditionals() {
        double[][] features = { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 }, { 1, 1, 0 } };
        int[] labels = { 0, 0, 1, 1 };

        SortedMap<Integer, double[]> conditionals = NaiveBayesTrainer.estimateConditionalProbabilities(features,
                labels, 1.0, 3);

        assertEquals(2, conditionals.size());
        assertArrayEquals(new double[] { 0.4, 0.4, 0.2 }, conditionals.get(0), 1e-12);
    }

    @Test
    void testSmoothingAddedOncePerClass() {
        // three rows of the same class, delta only enters the first
        double[][] features = { { 1, 0 }, { 1, 0 }, { 1, 0 } };
        int[] labels = { 4, 4, 4 };

        SortedMap<Integer, double[]> conditionals = NaiveBayesTrainer.estimateConditionalProbabilities(features,
                labels, 1.0, 2);

        // denominator 2 * 1 + 3 = 5; (1 + 1 + 1 + 1) / 5 and (0 + 1) / 5
        assertArrayEquals(new double[] { 0.8, 0.2 }, conditionals.get(4), 1e-12);
    }

    @Test
    void testConditionalsStrictlyPositiveWithSmoothing() {
        double[][] features = {
                { 0, 0, 4, 0, 0 },
                { 0, 2, 0, 0, 0 },
                { 7, 0, 0, 0, 0 },
                { 0, 0, 0, 0, 1 }
        };
        int[] labels = { 1, 1, 0, 2 };

        for (double delta : new double[] { 1e-3, 0.5, 1.0, 3.0 }) {
            SortedMap<Integer, double[]> conditionals = NaiveBayesTrainer.estimateConditionalProbabilities(features,
                    labels, delta, 5);
            for (double[] vector : conditionals.values()) {
                assertEquals(5, vector.length);
                for (double p : vector) {
                    assertTrue(p > 0.0, "delta=" + delta);
                }
            }
        }
    }

    @Test
    void testRaggedRowsFail() {
        double[][] features = { { 1, 0, 0 }, { 0, 1 } };
        int[] labels = { 0, 1 };
        assertThrows(IllegalArgumentException.class,
                () -> NaiveBayesTrainer.estimateConditionalProbabilities(features, labels, 1.0, 3));
    }

    @Test
    void testMissingRowsFail() {
        int[] labels = { 0, 1 };
        assertThrows(IllegalArgumentException.class,
                () -> NaiveBayesTrainer.estimateConditionalProbabilities(new double[][] { { 1, 0 }, null }, labels,
                        1.0, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new NaiveBayesTrainer().train(new double[][] { null, { 0, 1 } }, labels, 1.0));
    }

    @Test
    void testTrainBuildsOrderedModel() {
        double[][] features = { { 2, 0 }, { 0, 2 }, { 1, 1 } };
        int[] labels = { 30, 10, 20 };

        TrainedNaiveBayesModel model = new NaiveBayesTrainer(VocabularySizing.FEATURE_WIDTH).train(features, labels,
                1.0);

        assertTrue(model.isTrained());
        assertSame(model, model.requireTrained());
        assertArrayEquals(new int[] { 10, 20, 30 }, model.getLabels());
        assertEquals(2, model.getVocabularySize());
        assertEquals(2, model.getFeatureWidth());

        List<ClassParameters> classes = model.getClasses();
        assertEquals(10, classes.get(0).getLabel());
        assertEquals(1.0 / 3, classes.get(0).getPrior(), 1e-12);
        assertThrows(UnsupportedOperationException.class, () -> classes.remove(0));
    }

    @Test
    void testUntrainedModel() {
        assertFalse(UntrainedModel.INSTANCE.isTrained());
        assertThrows(ModelNotTrainedException.class, UntrainedModel.INSTANCE::requireTrained);
    }

    @Test
    void testModelRejectsInconsistentClasses() {
        ClassParameters a = new ClassParameters(0, 0.5, new double[] { 0.5, 0.5 });
        ClassParameters b = new ClassParameters(1, 0.5, new double[] { 1.0 });
        ClassParameters dup = new ClassParameters(0, 0.5, new double[] { 0.2, 0.8 });

        assertThrows(IllegalArgumentException.class, () -> new TrainedNaiveBayesModel(List.of(a, b), 2, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new TrainedNaiveBayesModel(List.of(a, dup), 2, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new TrainedNaiveBayesModel(List.of(), 2, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ClassParameters(3, 0.0, new double[] { 1.0 }));
    }
}
