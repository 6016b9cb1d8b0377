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

package com.amazon.streamingrcf.threshold;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A {@link Deviation} over the most recent {@code windowSize} values. The
 * oldest value is removed from the statistics when a new one pushes it out of
 * the window.
 */
public class WindowedDeviation extends Deviation {

    private final int windowSize;

    private final Deque<Double> window = new ArrayDeque<>();

    public WindowedDeviation(int windowSize) {
        checkArgument(windowSize > 0, "window size must be positive");
        this.windowSize = windowSize;
    }

    /**
     * Recreates the statistics by replaying the values, oldest first.
     */
    public WindowedDeviation(int windowSize, List<Double> values) {
        this(windowSize);
        checkArgument(values.size() <= windowSize, "more values than the window holds");
        values.forEach(this::update);
    }

    @Override
    public void update(double value) {
        window.addLast(value);
        super.update(value);
        if (window.size() > windowSize) {
            remove(window.removeFirst());
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * @return the values in the window, oldest first
     */
    public List<Double> getValues() {
        return new ArrayList<>(window);
    }
}
