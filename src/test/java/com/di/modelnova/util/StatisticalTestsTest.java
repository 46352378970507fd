package com.di.modelnova.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatisticalTests Tests")
class StatisticalTestsTest {

    // ============================================================================
    // Chi-square
    // ============================================================================

    @Test
    @DisplayName("Should compute Yates-corrected chi-square for 520/600 vs 560/600")
    void testChiSquare_KnownTable() {
        StatisticalTests.ChiSquare result = StatisticalTests.chiSquare2x2(520, 80, 560, 40);
        assertEquals(14.0833, result.getStatistic(), 1e-3);
        assertTrue(result.getPValue() < 0.001, "p-value " + result.getPValue());
        assertTrue(result.getPValue() > 0.0);
    }

    @Test
    @DisplayName("Should return statistic 0 and p-value 1 for identical arms")
    void testChiSquare_IdenticalArms() {
        StatisticalTests.ChiSquare result = StatisticalTests.chiSquare2x2(90, 10, 90, 10);
        assertEquals(0.0, result.getStatistic(), 1e-12);
        assertEquals(1.0, result.getPValue(), 1e-12);
    }

    @Test
    @DisplayName("Should treat a table with an empty column as no evidence")
    void testChiSquare_EmptyColumn() {
        StatisticalTests.ChiSquare result = StatisticalTests.chiSquare2x2(50, 0, 40, 0);
        assertEquals(0.0, result.getStatistic());
        assertEquals(1.0, result.getPValue());
    }

    @Test
    @DisplayName("Should match the 1-dof chi-square tail at the 5% critical value")
    void testChiSquarePValue_CriticalValue() {
        assertEquals(0.05, StatisticalTests.chiSquarePValue1Dof(3.841), 1e-3);
        assertEquals(1.0, StatisticalTests.chiSquarePValue1Dof(0.0));
    }

    // ============================================================================
    // Kolmogorov-Smirnov
    // ============================================================================

    @Test
    @DisplayName("Should return 0 for identical samples")
    void testKs_IdenticalSamples() {
        double[] sample = {1.0, 2.0, 3.0, 4.0, 5.0};
        assertEquals(0.0, StatisticalTests.ksStatistic(sample, sample.clone()), 1e-12);
    }

    @Test
    @DisplayName("Should return 1 for disjoint samples")
    void testKs_DisjointSamples() {
        double[] low = {1.0, 2.0, 3.0};
        double[] high = {10.0, 11.0, 12.0, 13.0};
        assertEquals(1.0, StatisticalTests.ksStatistic(low, high), 1e-12);
        assertTrue(StatisticalTests.ksPValue(1.0, 3, 4) < 0.1);
    }

    @Test
    @DisplayName("Should separate a shifted normal sample from its baseline")
    void testKs_ShiftedNormal() {
        Random random = new Random(7);
        double[] baseline = StatisticalTests.normalSample(60, 10, 2000, random);
        double[] same = StatisticalTests.normalSample(60, 10, 2000, random);
        double[] shifted = StatisticalTests.normalSample(75, 10, 2000, random);

        assertTrue(StatisticalTests.ksStatistic(same, baseline) < 0.1);
        double shiftedKs = StatisticalTests.ksStatistic(shifted, baseline);
        assertTrue(shiftedKs > 0.4, "KS " + shiftedKs);
        assertTrue(StatisticalTests.ksPValue(shiftedKs, 2000, 2000) < 1e-6);
    }

    @Test
    @DisplayName("Should reject empty KS samples")
    void testKs_Empty() {
        assertThrows(IllegalArgumentException.class,
                () -> StatisticalTests.ksStatistic(new double[0], new double[]{1.0}));
    }

    // ============================================================================
    // Classification metrics
    // ============================================================================

    @Test
    @DisplayName("Should compute accuracy and weighted F1")
    void testAccuracyAndF1() {
        List<Double> truth = List.of(1.0, 1.0, 0.0, 0.0);
        List<Double> predicted = List.of(1.0, 0.0, 0.0, 0.0);

        assertEquals(0.75, StatisticalTests.accuracy(truth, predicted), 1e-12);
        // class 1: p=1, r=0.5, f1=2/3; class 0: p=2/3, r=1, f1=0.8; support 2 each
        assertEquals((2.0 / 3.0 + 0.8) / 2.0, StatisticalTests.weightedF1(truth, predicted), 1e-9);
    }

    @Test
    @DisplayName("Should reject truth and predictions of different size")
    void testAccuracy_SizeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> StatisticalTests.accuracy(List.of(1.0), List.of(1.0, 0.0)));
    }

    @Test
    @DisplayName("Should compute mean and population std")
    void testMeanAndStd() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        assertEquals(5.0, StatisticalTests.mean(values), 1e-12);
        assertEquals(2.0, StatisticalTests.std(values), 1e-12);
        assertTrue(Double.isNaN(StatisticalTests.mean(new double[0])));
    }
}
