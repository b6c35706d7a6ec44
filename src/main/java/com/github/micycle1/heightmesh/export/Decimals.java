package com.github.micycle1.heightmesh.export;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.error.MeshEncodingException;

/**
 * Locale-independent number formatting for the text writers.
 * <p>
 * Fixed-point output rounds the exact binary value half-even, so identical
 * doubles always print identically. Negative zero prints as zero.
 */
final class Decimals {

	private static final int DIGITS_8_BIT = 6;
	private static final int DIGITS_16_BIT = 7;

	private final MeshFormat format;
	private final int digits;

	private Decimals(MeshFormat format, int digits) {
		this.format = format;
		this.digits = digits;
	}

	/**
	 * 16 bit sources step by 1/65535 and need one more digit than 8 bit
	 * sources.
	 */
	static Decimals forBitDepth(MeshFormat format, int bitDepth) {
		return new Decimals(format, bitDepth == 16 ? DIGITS_16_BIT : DIGITS_8_BIT);
	}

	int digits() {
		return digits;
	}

	/** Fixed point with trailing zeros and a dangling point removed. */
	String trimmed(double value) {
		return round(value).stripTrailingZeros().toPlainString();
	}

	/** Fixed point with exactly {@link #digits()} fractional digits. */
	String fixed(double value) {
		return round(value).toPlainString();
	}

	/** Scientific notation with six fractional digits, as ASCII STL readers expect. */
	String scientific(double value) {
		return String.format(Locale.ROOT, "%.6e", check(value) + 0.0);
	}

	double check(double value) {
		if (!Double.isFinite(value)) {
			throw new MeshEncodingException(format, value);
		}
		return value;
	}

	private BigDecimal round(double value) {
		return new BigDecimal(check(value)).setScale(digits, RoundingMode.HALF_EVEN);
	}
}
