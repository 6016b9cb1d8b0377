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

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.amazon.streamingrcf.examples.detection.BatchTrainingExample;
import com.amazon.streamingrcf.examples.detection.StreamingDetectionExample;
import com.amazon.streamingrcf.examples.serialization.JsonExample;
import com.amazon.streamingrcf.examples.serialization.ProtostuffExample;

/**
 * Command line entry point that dispatches to an {@link Example} by its command
 * name.
 */
public class Main {

    public static final String ARCHIVE_NAME = "streaming-rcf-examples-1.0.0.jar";

    private static final List<String> HELP_FLAGS = List.of("-h", "--help");

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    private final SortedMap<String, Example> examples;

    public Main() {
        this(Stream.of(new BatchTrainingExample(), new StreamingDetectionExample(), new JsonExample(),
                new ProtostuffExample()));
    }

    Main(Stream<Example> registered) {
        examples = Collections.unmodifiableSortedMap(registered.collect(
                Collectors.<Example, String, Example, TreeMap<String, Example>>toMap(Example::command, Function.identity(), (first, second) -> {
                    throw new IllegalStateException("duplicate example command " + first.command());
                }, TreeMap::new)));
    }

    public void run(String[] args) throws Exception {
        Optional<String> command = Optional.ofNullable(args).filter(a -> a.length > 0).map(a -> a[0])
                .filter(a -> !HELP_FLAGS.contains(a));
        if (command.isEmpty()) {
            printUsage();
            return;
        }
        Example example = Optional.ofNullable(examples.get(command.get()))
                .orElseThrow(() -> new IllegalArgumentException("No such example: " + command.get()));
        example.run();
    }

    public void printUsage() {
        System.out.printf("Usage: java -cp %s %s [example]%n", ARCHIVE_NAME, Main.class.getName());
        System.out.println("Examples:");
        int width = examples.keySet().stream().mapToInt(String::length).max().orElse(1);
        examples.forEach((command, example) -> System.out
                .println("\t " + " ".repeat(width - command.length()) + command + " - " + example.description()));
    }

    SortedMap<String, Example> getExamples() {
        return examples;
    }
}
