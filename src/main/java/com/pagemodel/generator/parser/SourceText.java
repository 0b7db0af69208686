package com.pagemodel.generator.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.pagemodel.generator.model.SourceLocation;

import lombok.Getter;

/**
 * File content with a line-start table for turning offsets into line/column positions.
 */
@Getter
public class SourceText {

    private final String fileName;
    private final String content;
    private final int[] lineStarts;

    public SourceText(String fileName, String content) {
        this.fileName = fileName;
        this.content = content;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public SourceLocation locationOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new SourceLocation(line + 1, offset - lineStarts[line] + 1, offset);
    }
}
