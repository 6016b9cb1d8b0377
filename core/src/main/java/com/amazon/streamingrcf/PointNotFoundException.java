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

package com.amazon.streamingrcf;

import java.util.Arrays;

/**
 * Thrown when a delete targets a point value that is not stored in a tree. The
 * tree is left unchanged.
 */
public class PointNotFoundException extends IllegalArgumentException {

    public PointNotFoundException(double[] point) {
        super("point not present in tree: " + Arrays.toString(point));
    }
}
