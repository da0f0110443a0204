package structview;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class SourceLocatorTest {

    private static final String TEXT = "alpha\nbravo\ncharlie";

    @Test
    public void offsetsMatchManualSlicing() {
        SourceLocator.Offsets o = SourceLocator.toOffsets(TEXT, 2, 2, 3, 4);
        assertEquals(7, o.start());
        assertEquals(15, o.end());

        SourceRange range = SourceLocator.locate(TEXT, new SourceSpan(2, 2, 3, 4));
        assertEquals(TEXT.substring(7, 15), range.text(TEXT));
        assertEquals("ravo\ncha", range.text(TEXT));
    }

    @Test
    public void singleLineSpan() {
        SourceRange range = SourceLocator.locate(TEXT, new SourceSpan(1, 1, 1, 6));
        assertEquals("alpha", range.text(TEXT));
        assertEquals(5, range.length());
    }

    @Test
    public void missingLinesFallBackToWholeDocument() {
        SourceLocator.Offsets o = SourceLocator.toOffsets(TEXT, 9, 1, 12, 1);
        assertEquals(0, o.start());
        assertEquals(TEXT.length(), o.end());
    }

    @Test
    public void columnsPastTheEndAreClamped() {
        SourceLocator.Offsets o = SourceLocator.toOffsets(TEXT, 3, 1, 3, 500);
        assertEquals(12, o.start());
        assertEquals(TEXT.length(), o.end());
    }

    @Test
    public void nonPositiveColumnsCountAsLineStart() {
        SourceLocator.Offsets o = SourceLocator.toOffsets(TEXT, 2, 0, 2, -3);
        assertEquals(6, o.start());
        assertEquals(6, o.end());
    }

    @Test
    public void nullTextIsEmpty() {
        SourceLocator.Offsets o = SourceLocator.toOffsets(null, 1, 1, 1, 5);
        assertEquals(0, o.start());
        assertEquals(0, o.end());
    }

    @Test
    public void noSpanMeansNoRange() {
        assertNull(SourceLocator.locate(TEXT, null));
    }
}
