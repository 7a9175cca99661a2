package org.oldskooler.computedhash.algorithm;

import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;

import java.util.Locale;

/**
 * Hash functions understood by SQL Server's {@code HASHBYTES}.
 * <p>
 * The legacy entries are deprecated by SQL Server 2016 and are flagged as not
 * cryptographically secure, but they stay usable so existing schemas keep migrating.
 * </p>
 */
public enum HashAlgorithm {
    MD2(16, false),
    MD4(16, false),
    MD5(16, false),
    SHA(20, false),
    SHA1(20, false),
    SHA2_256(32, true),
    SHA2_512(64, true);

    private final int width;
    private final boolean secure;

    HashAlgorithm(int width, boolean secure) {
        this.width = width;
        this.secure = secure;
    }

    /**
     * Size in bytes of the digest this algorithm produces.
     */
    public int width() {
        return width;
    }

    /**
     * True for algorithms still considered cryptographically secure.
     */
    public boolean isSecure() {
        return secure;
    }

    /**
     * Recommended SQL Server storage type, e.g. {@code BINARY(32)}.
     */
    public String recommendedSqlType() {
        return "BINARY(" + width + ")";
    }

    /**
     * Name as passed to {@code HASHBYTES}.
     */
    public String sqlName() {
        return name();
    }

    public static int widthOf(HashAlgorithm algorithm) {
        return algorithm.width();
    }

    public static boolean isSecure(HashAlgorithm algorithm) {
        return algorithm.isSecure();
    }

    /**
     * Case-insensitive lookup of a free-text algorithm name.
     *
     * @param name algorithm name such as {@code "sha2_256"}
     * @return the matching algorithm
     * @throws ComputedHashException with {@link Violation#UNKNOWN_ALGORITHM} naming the token
     */
    public static HashAlgorithm fromName(String name) {
        return fromName(name, null);
    }

    /**
     * Same as {@link #fromName(String)}, attributing a failure to {@code column}.
     */
    public static HashAlgorithm fromName(String name, String column) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (HashAlgorithm a : values()) {
                if (a.name().equals(key)) return a;
            }
        }
        throw new ComputedHashException(Violation.UNKNOWN_ALGORITHM, column,
                "Got: '" + name + "'");
    }
}
