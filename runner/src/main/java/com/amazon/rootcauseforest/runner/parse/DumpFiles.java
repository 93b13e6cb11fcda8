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

package com.amazon.rootcauseforest.runner.parse;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves a dump location to the files it names. A regular file stands for
 * itself; a directory stands for the regular files directly inside it, in name
 * order.
 */
public final class DumpFiles {

    private DumpFiles() {
    }

    public static List<Path> list(Path location) throws IOException {
        checkNotNull(location, "location must not be null");
        if (Files.isRegularFile(location)) {
            List<Path> single = new ArrayList<>();
            single.add(location);
            return single;
        }
        if (!Files.isDirectory(location)) {
            throw new IOException("no such file or directory: " + location);
        }
        try (Stream<Path> children = Files.list(location)) {
            return children.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    public static List<String> readLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    /**
     * @param file a dump file
     * @return the file name without its extension
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }
}
