package com.maxdemarzi.kmap.kmap;

import org.apache.commons.lang3.StringUtils;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text form of a term assignment: {@code 0,1,3,d4,5d}. A {@code d} on either side of the
 * number marks a don't-care.
 */
public class MintermList {

    private static final Pattern SEPARATOR = Pattern.compile("[,;\\s]+");
    private static final Pattern TERM = Pattern.compile("^([dD]?)(\\d+)([dD]?)$");

    private final RoaringBitmap minterms;
    private final RoaringBitmap dontcares;

    public MintermList(RoaringBitmap minterms, RoaringBitmap dontcares) {
        this.minterms = RoaringBitmap.andNot(minterms, dontcares);
        this.dontcares = dontcares.clone();
    }

    /**
     * Tokens that do not look like a term, or whose number does not fit an int, are skipped.
     * A number given both plain and with {@code d} is kept as a don't-care only.
     */
    public static MintermList parse(String text) {
        RoaringBitmap minterms = new RoaringBitmap();
        RoaringBitmap dontcares = new RoaringBitmap();
        if (StringUtils.isBlank(text)) {
            return new MintermList(minterms, dontcares);
        }
        for (String token : SEPARATOR.split(text.trim())) {
            Matcher matcher = TERM.matcher(token);
            if (!matcher.matches()) {
                continue;
            }
            int term;
            try {
                term = Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException e) {
                continue;
            }
            if (matcher.group(1).isEmpty() && matcher.group(3).isEmpty()) {
                minterms.add(term);
            } else {
                dontcares.add(term);
            }
        }
        return new MintermList(minterms, dontcares);
    }

    /** Minterms as bare numbers, then don't-cares with a leading {@code d}, comma separated. */
    public static String format(RoaringBitmap minterms, RoaringBitmap dontcares) {
        StringJoiner text = new StringJoiner(",");
        IntIterator it = minterms.getIntIterator();
        while (it.hasNext()) {
            text.add(String.valueOf(it.next()));
        }
        it = dontcares.getIntIterator();
        while (it.hasNext()) {
            text.add("d" + it.next());
        }
        return text.toString();
    }

    public RoaringBitmap getMinterms() {
        return minterms.clone();
    }

    public RoaringBitmap getDontcares() {
        return dontcares.clone();
    }

    @Override
    public String toString() {
        return format(minterms, dontcares);
    }
}
