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

package com.amazon.streamingrcf.store;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.Arrays;

/**
 * Keeps track of free slots in an array-backed store as a stack of closed
 * intervals [start, end]. Released indices are merged with the interval on top
 * of the stack when adjacent, so a store that is filled and drained in order
 * needs a single interval.
 */
public class IndexIntervalManager {

    protected int capacity;
    protected int[] freeIndexesStart;
    protected int[] freeIndexesEnd;
    protected int lastInUse;

    public IndexIntervalManager(int capacity) {
        checkArgument(capacity > 0, "incorrect parameters");
        freeIndexesEnd = new int[] { capacity - 1 };
        freeIndexesStart = new int[] { 0 };
        lastInUse = 1;
        this.capacity = capacity;
    }

    /**
     * Adds the slots [capacity, newCapacity) to the free set.
     *
     * @param newCapacity the new capacity, strictly larger than the current one
     */
    public void extendCapacity(int newCapacity) {
        checkArgument(newCapacity > capacity, " incorrect call, we can only increase capacity");
        ensureStackRoom();
        freeIndexesStart[lastInUse] = capacity;
        freeIndexesEnd[lastInUse] = newCapacity - 1;
        lastInUse += 1;
        capacity = newCapacity;
    }

    public boolean isEmpty() {
        return lastInUse == 0;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the number of free indices
     */
    public int size() {
        int sum = 0;
        for (int i = 0; i < lastInUse; i++) {
            sum += freeIndexesEnd[i] - freeIndexesStart[i] + 1;
        }
        return sum;
    }

    /**
     * Take an index from the free index stack.
     *
     * @return a free index that can be used to store a value.
     */
    public int takeIndex() {
        checkState(lastInUse > 0, "store is full");
        int answer = freeIndexesStart[lastInUse - 1];
        if (answer == freeIndexesEnd[lastInUse - 1]) {
            lastInUse -= 1;
        } else {
            freeIndexesStart[lastInUse - 1] = answer + 1;
        }
        return answer;
    }

    /**
     * Release an index. After the release, the index value may be returned in a
     * future call to {@link #takeIndex()}.
     *
     * @param index The index value to release.
     */
    public void releaseIndex(int index) {
        checkArgument(index >= 0 && index < capacity, "index out of range");
        if (lastInUse > 0) {
            if (freeIndexesStart[lastInUse - 1] == index + 1) {
                freeIndexesStart[lastInUse - 1] = index;
                return;
            } else if (freeIndexesEnd[lastInUse - 1] + 1 == index) {
                freeIndexesEnd[lastInUse - 1] = index;
                return;
            }
        }
        ensureStackRoom();
        freeIndexesStart[lastInUse] = index;
        freeIndexesEnd[lastInUse] = index;
        lastInUse += 1;
    }

    private void ensureStackRoom() {
        if (freeIndexesStart.length == lastInUse) {
            freeIndexesStart = Arrays.copyOf(freeIndexesStart, lastInUse + 1);
            freeIndexesEnd = Arrays.copyOf(freeIndexesEnd, lastInUse + 1);
        }
    }
}
