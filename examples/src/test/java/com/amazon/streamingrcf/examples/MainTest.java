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

package com.amazon.streamingrcf.examples;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

public class MainTest {

    @Test
    public void testExamplesAreRegisteredByCommand() {
        Main main = new Main();
        assertEquals(Arrays.asList("batch_training", "json", "protostuff", "streaming_detection"),
                Arrays.asList(main.getExamples().keySet().toArray()));
        main.getExamples().forEach((command, example) -> assertEquals(command, example.command()));
    }

    @Test
    public void testUnknownExample() {
        assertThrows(IllegalArgumentException.class, () -> new Main().run(new String[] { "no_such_example" }));
        assertDoesNotThrow(() -> new Main().run(new String[] { "--help" }));
    }

    @Test
    public void testRunExamples() {
        assertDoesNotThrow(() -> new Main().run(new String[] { "batch_training" }));
        assertDoesNotThrow(() -> new Main().run(new String[] { "json" }));
    }

    @Test
    public void testDispatchesToRegisteredExample() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Main main = new Main(Stream.of(new CountingExample("count", runs)));
        main.run(new String[] { "count" });
        main.run(new String[] { "-h" });
        main.run(new String[0]);
        assertEquals(1, runs.get());
    }

    @Test
    public void testDuplicateCommandsAreRejected() {
        AtomicInteger runs = new AtomicInteger();
        assertThrows(IllegalStateException.class,
                () -> new Main(Stream.of(new CountingExample("same", runs), new CountingExample("same", runs))));
    }

    private static class CountingExample implements Example {

        private final String command;
        private final AtomicInteger runs;

        CountingExample(String command, AtomicInteger runs) {
            this.command = command;
            this.runs = runs;
        }

        @Override
        public String command() {
            return command;
        }

        @Override
        public String description() {
            return "counts its runs";
        }

        @Override
        public void run() {
            runs.incrementAndGet();
        }
    }
}
