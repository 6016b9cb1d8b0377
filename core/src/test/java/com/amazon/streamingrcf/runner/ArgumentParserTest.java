/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.streamingrcf.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(50, parser.getNumberOfTrees());
        assertEquals(256, parser.getSampleSize());
        assertEquals(1, parser.getShingleSize());
        assertEquals(3.0, parser.getDeviationMultiplier());
        assertEquals(256, parser.getMinimumObservations());
        assertEquals(0, parser.getWindowSize());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(42, parser.getRandomSeed());
    }

    @Test
    public void testParse() {
        parser.parse("--number-of-trees", "222", "--sample-size", "123", "--shingle-size", "4",
                "--deviation-multiplier", "2.5", "--window-size", "50", "--delimiter", "\t", "--header-row", "true",
                "--random-seed", "7");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals(4, parser.getShingleSize());
        assertEquals(2.5, parser.getDeviationMultiplier());
        // follows the sample size unless given
        assertEquals(123, parser.getMinimumObservations());
        assertEquals(50, parser.getWindowSize());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(7, parser.getRandomSeed());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-n", "222", "-s", "123", "-g", "4", "-k", "1.5", "-m", "10", "-w", "50", "-d", "\t");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals(4, parser.getShingleSize());
        assertEquals(1.5, parser.getDeviationMultiplier());
        assertEquals(10, parser.getMinimumObservations());
        assertEquals(50, parser.getWindowSize());
        assertEquals("\t", parser.getDelimiter());
    }

    @Test
    public void testDuplicateFlagsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.addArgument(
                new ArgumentParser.IntegerArgument("-n", "--other", "duplicate short flag", 1)));
        assertThrows(IllegalArgumentException.class, () -> parser.addArgument(
                new ArgumentParser.IntegerArgument(null, "--window-size", "duplicate long flag", 1)));
    }

    @Test
    public void testArgumentValidation() {
        ArgumentParser.IntegerArgument argument = new ArgumentParser.IntegerArgument("-x", "--x", "an argument", 1,
                n -> {
                    if (n < 0) {
                        throw new IllegalArgumentException("negative");
                    }
                });
        argument.parse("5");
        assertEquals(5, argument.getValue());
        assertThrows(IllegalArgumentException.class, () -> argument.parse("-1"));
        assertThrows(NumberFormatException.class, () -> argument.parse("five"));
        assertEquals("--x, -x: an argument (default: 1)", argument.getHelpMessage());
    }
}
