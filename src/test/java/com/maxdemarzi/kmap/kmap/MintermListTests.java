package com.maxdemarzi.kmap.kmap;

import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class MintermListTests {

    @Test
    void shouldReadDontCareMarkersOnEitherSide() {
        MintermList terms = MintermList.parse("0,1,3,d4,5d,D6,7D");
        assertThat(terms.getMinterms().toArray()).containsExactly(0, 1, 3);
        assertThat(terms.getDontcares().toArray()).containsExactly(4, 5, 6, 7);
    }

    @Test
    void shouldSplitOnCommasSemicolonsAndWhitespace() {
        MintermList terms = MintermList.parse(" 1; 2  3,\t4 ");
        assertThat(terms.getMinterms().toArray()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void shouldSkipMalformedTokens() {
        MintermList terms = MintermList.parse("x, 2a, -3, dd5, 4, 99999999999");
        assertThat(terms.getMinterms().toArray()).containsExactly(4);
        assertThat(terms.getDontcares().isEmpty()).isTrue();
    }

    @Test
    void shouldSortAndDeduplicate() {
        MintermList terms = MintermList.parse("5,3,5,1,d2,2d");
        assertThat(terms.getMinterms().toArray()).containsExactly(1, 3, 5);
        assertThat(terms.getDontcares().toArray()).containsExactly(2);
    }

    @Test
    void shouldPreferDontCareWhenBothGiven() {
        MintermList terms = MintermList.parse("3,d3");
        assertThat(terms.getMinterms().isEmpty()).isTrue();
        assertThat(terms.getDontcares().toArray()).containsExactly(3);
    }

    @Test
    void shouldReadBlankAsEmpty() {
        assertThat(MintermList.parse("").getMinterms().isEmpty()).isTrue();
        assertThat(MintermList.parse(null).getDontcares().isEmpty()).isTrue();
    }

    @Test
    void shouldFormatMintermsThenDontCares() {
        assertEquals("1,3,d4", MintermList.format(RoaringBitmap.bitmapOf(3, 1), RoaringBitmap.bitmapOf(4)));
        assertEquals("", MintermList.format(new RoaringBitmap(), new RoaringBitmap()));
        assertEquals("0,1,3,d4,d5", MintermList.parse("0,1,3,d4,5d").toString());
    }
}
