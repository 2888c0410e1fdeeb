package io.reviewmind.core.review;

import java.io.PrintStream;
import java.util.OptionalInt;

public final class PrintStreamCommentSink implements CommentSink {
    private final PrintStream out;

    public PrintStreamCommentSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void postInline(String filePath, int line, OptionalInt position, String body) {
        if (position.isPresent()) {
            out.println("### " + filePath + ":" + line + " (diff position " + position.getAsInt() + ")");
        } else {
            out.println("**File: `" + filePath + "`** (line ~" + line + ")");
        }
        out.println();
        out.println(body);
        out.println();
    }

    @Override
    public void postGeneral(String body) {
        out.println(body);
        out.println();
    }
}
