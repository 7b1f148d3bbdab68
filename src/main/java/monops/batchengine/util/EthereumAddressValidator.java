package monops.batchengine.util;

import java.util.Locale;

import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

/**
 * Utility class for validating and comparing account and contract addresses
 */
public final class EthereumAddressValidator {

    private static final int ADDRESS_LENGTH_WITH_PREFIX = 42; // 0x + 40 hex chars

    private EthereumAddressValidator() {
    }

    /**
     * Validates an address format. Single-case addresses are accepted as is; mixed-case
     * addresses must carry a valid EIP-55 checksum.
     *
     * @param address The address to validate
     * @return true if valid, false otherwise
     */
    public static boolean isValidAddress(String address) {
        if (address == null || address.length() != ADDRESS_LENGTH_WITH_PREFIX || !address.startsWith("0x")) {
            return false;
        }
        try {
            Numeric.toBigInt(address);
        } catch (Exception e) {
            return false;
        }

        String body = address.substring(2);
        if (body.equals(body.toLowerCase(Locale.ROOT)) || body.equals(body.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return matchesChecksum(address);
    }

    /**
     * Lowercases a valid address so it can be used as a comparison or storage key.
     *
     * @throws IllegalArgumentException if the address is invalid
     */
    public static String normalize(String address) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Invalid address: " + LogSanitizer.sanitize(address));
        }
        return address.toLowerCase(Locale.ROOT);
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }

    private static boolean matchesChecksum(String address) {
        try {
            String normalized = "0x" + address.substring(2).toLowerCase(Locale.ROOT);
            return Keys.toChecksumAddress(normalized).equals(address);
        } catch (Exception e) {
            return false;
        }
    }
}
