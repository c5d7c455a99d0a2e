package util;

import frontend.CFGBuilder;
import frontend.Listing;
import frontend.ListingParseException;
import frontend.ListingReader;
import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the listings under {@code test-resources/listings}.
 */
public final class TestListings {
    private TestListings() {
    }

    public static String text(String name) {
        try (InputStream in = TestListings.class.getResourceAsStream("/listings/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("no listing " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Listing listing(String name) {
        return parse(text(name), name);
    }

    public static Listing parse(String text, String sourceName) {
        try {
            return new ListingReader().read(text, sourceName);
        } catch (ListingParseException e) {
            throw new AssertionError("fixture " + sourceName + " does not parse: " + e.getMessage(), e);
        }
    }

    public static IRModule module(String name) {
        return new CFGBuilder().build(listing(name));
    }

    public static Function function(String name) {
        return module(name).getFunctions().get(0);
    }

    public static BasicBlock blockAt(Function f, long address) {
        for (BasicBlock bb : f.getBlocks()) {
            if (bb.getStartAddress() == address) {
                return bb;
            }
        }
        throw new AssertionError("no block at 0x" + Long.toHexString(address) + " in " + f.getName());
    }
}
