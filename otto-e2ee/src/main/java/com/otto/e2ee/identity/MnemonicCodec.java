package com.otto.e2ee.identity;

import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * BIP-39 mapping between an identity seed and its English recovery phrase.
 *
 * The seed is used as BIP-39 entropy directly (256 bits → 24 words), not as the
 * PBKDF2 output, so the phrase converts back to exactly the same 32 bytes.
 */
public class MnemonicCodec {

    public static final int WORD_COUNT = 24;

    private final MnemonicCode mnemonicCode;

    public MnemonicCodec() {
        this(defaultMnemonicCode());
    }

    public MnemonicCodec(MnemonicCode mnemonicCode) {
        if (mnemonicCode == null) {
            throw new IllegalArgumentException("Mnemonic code cannot be null");
        }
        this.mnemonicCode = mnemonicCode;
    }

    public String toPhrase(IdentitySeed seed) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed cannot be null");
        }
        try {
            return String.join(" ", mnemonicCode.toMnemonic(seed.toBytes()));
        } catch (MnemonicException.MnemonicLengthException e) {
            // Unreachable for a 32-byte seed
            throw new IllegalStateException("Seed length rejected by BIP-39 encoder", e);
        }
    }

    /**
     * Recovers the seed from a phrase. Case and surrounding whitespace are ignored.
     *
     * @throws InvalidMnemonicException for unknown words, a wrong word count or a bad checksum
     */
    public IdentitySeed toSeed(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new InvalidMnemonicException("Recovery phrase is empty");
        }
        List<String> words = Arrays.asList(phrase.trim().toLowerCase(Locale.ROOT).split("\\s+"));
        if (words.size() != WORD_COUNT) {
            throw new InvalidMnemonicException(
                    "Recovery phrase must have " + WORD_COUNT + " words, got " + words.size());
        }
        try {
            return IdentitySeed.of(mnemonicCode.toEntropy(words));
        } catch (MnemonicException.MnemonicWordException e) {
            throw new InvalidMnemonicException("Unknown word in recovery phrase: " + e.badWord, e);
        } catch (MnemonicException.MnemonicChecksumException e) {
            throw new InvalidMnemonicException("Recovery phrase checksum does not match", e);
        } catch (MnemonicException e) {
            throw new InvalidMnemonicException("Invalid recovery phrase", e);
        }
    }

    private static MnemonicCode defaultMnemonicCode() {
        MnemonicCode code = MnemonicCode.INSTANCE;
        if (code == null) {
            throw new IllegalStateException("BIP-39 English wordlist could not be loaded");
        }
        return code;
    }
}
