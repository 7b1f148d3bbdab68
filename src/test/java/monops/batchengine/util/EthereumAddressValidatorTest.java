package monops.batchengine.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("EthereumAddressValidator Tests")
class EthereumAddressValidatorTest {

    private static final String CHECKSUMMED = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";

    @Test
    void acceptsLowercaseAndChecksummedAddresses() {
        assertThat(EthereumAddressValidator.isValidAddress(CHECKSUMMED.toLowerCase())).isTrue();
        assertThat(EthereumAddressValidator.isValidAddress(CHECKSUMMED)).isTrue();
        assertThat(EthereumAddressValidator.isValidAddress("0x000000000000000000000000000000000000dEaD")).isTrue();
    }

    @Test
    void rejectsMixedCaseWithBadChecksum() {
        assertThat(EthereumAddressValidator.isValidAddress("0x5AAeb6053F3E94C9b9A09f33669435E7Ef1BeAed")).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "0x123",
        "5aaeb6053f3e94c9b9a09f33669435e7ef1beaed00",
        "0xzzzeb6053f3e94c9b9a09f33669435e7ef1beaed",
        "not-an-address"
    })
    void rejectsMalformedAddresses(String address) {
        assertThat(EthereumAddressValidator.isValidAddress(address)).isFalse();
    }

    @Test
    void normalizeLowercasesValidAddress() {
        assertThat(EthereumAddressValidator.normalize(CHECKSUMMED)).isEqualTo(CHECKSUMMED.toLowerCase());
    }

    @Test
    void normalizeRejectsInvalidAddress() {
        assertThatThrownBy(() -> EthereumAddressValidator.normalize("0xnope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid address");
    }

    @Test
    void sameAddressIgnoresCase() {
        assertThat(EthereumAddressValidator.sameAddress(CHECKSUMMED, CHECKSUMMED.toLowerCase())).isTrue();
        assertThat(EthereumAddressValidator.sameAddress(CHECKSUMMED, null)).isFalse();
    }
}
