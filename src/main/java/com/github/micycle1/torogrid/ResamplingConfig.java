package com.github.micycle1.torogrid;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable options of a resampling pass. Build with {@link #builder()} or read
 * from {@link Properties} (keys prefixed {@code torogrid.}, see
 * {@link #fromProperties(Properties)}).
 */
public final class ResamplingConfig {

	/** How relaxation of the background profile is separated from turbulence. */
	public enum Decomposition {
		/** Subtract the toroidal average and fold its time average into the equilibrium. */
		TOROIDAL_AVERAGE,
		/** Subtract the global mean of every timestep; no equilibrium update. */
		MEAN_SUBTRACTION
	}

	/** How landing positions on the bracketing planes are found for 3-D grids. */
	public enum LandingMethod {
		/** Runge–Kutta integration of the equilibrium field line. */
		FIELD_LINE,
		/** Displacement along the stored next/previous node adjacency. */
		NODE_ADJACENCY
	}

	public static final String PREFIX = "torogrid.";

	private final boolean hasElectronDynamics;
	private final boolean loadIons;
	private final boolean applyRelaxationFilter;
	private final int substepsPerPlaneGap;
	private final int rkOrder;
	private final int nCrossSection;
	private final Decomposition decomposition;
	private final LandingMethod landingMethod;
	private final double accuracyTolerance;
	private final boolean parallel;

	private ResamplingConfig(Builder b) {
		this.hasElectronDynamics = b.hasElectronDynamics;
		this.loadIons = b.loadIons;
		this.applyRelaxationFilter = b.applyRelaxationFilter;
		this.substepsPerPlaneGap = b.substepsPerPlaneGap;
		this.rkOrder = b.rkOrder;
		this.nCrossSection = b.nCrossSection;
		this.decomposition = b.decomposition;
		this.landingMethod = b.landingMethod;
		this.accuracyTolerance = b.accuracyTolerance;
		this.parallel = b.parallel;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ResamplingConfig defaults() {
		return builder().build();
	}

	/**
	 * Reads options from properties; absent keys keep their defaults. Recognised
	 * keys: {@code torogrid.electronDynamics}, {@code torogrid.loadIons},
	 * {@code torogrid.relaxationFilter}, {@code torogrid.substeps},
	 * {@code torogrid.rkOrder}, {@code torogrid.crossSections},
	 * {@code torogrid.decomposition}, {@code torogrid.landingMethod},
	 * {@code torogrid.accuracyTolerance}, {@code torogrid.parallel}.
	 *
	 * @throws IllegalArgumentException for malformed values
	 */
	public static ResamplingConfig fromProperties(Properties p) {
		Builder b = builder();
		String v;
		if ((v = get(p, "electronDynamics")) != null) {
			b.hasElectronDynamics(parseBoolean("electronDynamics", v));
		}
		if ((v = get(p, "loadIons")) != null) {
			b.loadIons(parseBoolean("loadIons", v));
		}
		if ((v = get(p, "relaxationFilter")) != null) {
			b.applyRelaxationFilter(parseBoolean("relaxationFilter", v));
		}
		if ((v = get(p, "substeps")) != null) {
			b.substepsPerPlaneGap(parseInt("substeps", v));
		}
		if ((v = get(p, "rkOrder")) != null) {
			b.rkOrder(parseInt("rkOrder", v));
		}
		if ((v = get(p, "crossSections")) != null) {
			b.nCrossSection(parseInt("crossSections", v));
		}
		if ((v = get(p, "decomposition")) != null) {
			b.decomposition(parseEnum(Decomposition.class, "decomposition", v));
		}
		if ((v = get(p, "landingMethod")) != null) {
			b.landingMethod(parseEnum(LandingMethod.class, "landingMethod", v));
		}
		if ((v = get(p, "accuracyTolerance")) != null) {
			try {
				b.accuracyTolerance(Double.parseDouble(v));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(PREFIX + "accuracyTolerance: not a number: " + v, e);
			}
		}
		if ((v = get(p, "parallel")) != null) {
			b.parallel(parseBoolean("parallel", v));
		}
		return b.build();
	}

	/** Reads a properties resource (e.g. {@code torogrid.properties}). */
	public static ResamplingConfig fromStream(InputStream in) throws IOException {
		Properties p = new Properties();
		p.load(Objects.requireNonNull(in, "in must not be null"));
		return fromProperties(p);
	}

	public boolean hasElectronDynamics() {
		return hasElectronDynamics;
	}

	public boolean loadIons() {
		return loadIons;
	}

	public boolean applyRelaxationFilter() {
		return applyRelaxationFilter;
	}

	public int getSubstepsPerPlaneGap() {
		return substepsPerPlaneGap;
	}

	public int getRkOrder() {
		return rkOrder;
	}

	public int getNCrossSection() {
		return nCrossSection;
	}

	public Decomposition getDecomposition() {
		return decomposition;
	}

	public LandingMethod getLandingMethod() {
		return landingMethod;
	}

	public double getAccuracyTolerance() {
		return accuracyTolerance;
	}

	public boolean isParallel() {
		return parallel;
	}

	public Builder toBuilder() {
		return builder().hasElectronDynamics(hasElectronDynamics).loadIons(loadIons).applyRelaxationFilter(applyRelaxationFilter)
				.substepsPerPlaneGap(substepsPerPlaneGap).rkOrder(rkOrder).nCrossSection(nCrossSection).decomposition(decomposition)
				.landingMethod(landingMethod).accuracyTolerance(accuracyTolerance).parallel(parallel);
	}

	@Override
	public String toString() {
		return "ResamplingConfig{electrons=" + hasElectronDynamics + ", ions=" + loadIons + ", filter=" + applyRelaxationFilter + ", substeps="
				+ substepsPerPlaneGap + ", rkOrder=" + rkOrder + ", crossSections=" + nCrossSection + ", decomposition=" + decomposition
				+ ", landing=" + landingMethod + ", tol=" + accuracyTolerance + ", parallel=" + parallel + "}";
	}

	private static String get(Properties p, String key) {
		String v = p.getProperty(PREFIX + key);
		return v == null ? null : v.trim();
	}

	private static boolean parseBoolean(String key, String v) {
		if ("true".equalsIgnoreCase(v)) {
			return true;
		}
		if ("false".equalsIgnoreCase(v)) {
			return false;
		}
		throw new IllegalArgumentException(PREFIX + key + ": expected true or false, got " + v);
	}

	private static int parseInt(String key, String v) {
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(PREFIX + key + ": not an integer: " + v, e);
		}
	}

	private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String v) {
		try {
			return Enum.valueOf(type, v.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(PREFIX + key + ": unknown value " + v, e);
		}
	}

	public static final class Builder {

		private boolean hasElectronDynamics = true;
		private boolean loadIons = false;
		private boolean applyRelaxationFilter = false;
		private int substepsPerPlaneGap = 10;
		private int rkOrder = 2;
		private int nCrossSection = 1;
		private Decomposition decomposition = Decomposition.TOROIDAL_AVERAGE;
		private LandingMethod landingMethod = LandingMethod.FIELD_LINE;
		private double accuracyTolerance = 0.2;
		private boolean parallel = true;

		private Builder() {
		}

		public Builder hasElectronDynamics(boolean v) {
			this.hasElectronDynamics = v;
			return this;
		}

		public Builder loadIons(boolean v) {
			this.loadIons = v;
			return this;
		}

		public Builder applyRelaxationFilter(boolean v) {
			this.applyRelaxationFilter = v;
			return this;
		}

		public Builder substepsPerPlaneGap(int v) {
			this.substepsPerPlaneGap = v;
			return this;
		}

		public Builder rkOrder(int v) {
			this.rkOrder = v;
			return this;
		}

		public Builder nCrossSection(int v) {
			this.nCrossSection = v;
			return this;
		}

		public Builder decomposition(Decomposition v) {
			this.decomposition = v;
			return this;
		}

		public Builder landingMethod(LandingMethod v) {
			this.landingMethod = v;
			return this;
		}

		public Builder accuracyTolerance(double v) {
			this.accuracyTolerance = v;
			return this;
		}

		public Builder parallel(boolean v) {
			this.parallel = v;
			return this;
		}

		/**
		 * @throws IllegalArgumentException if an option is out of range
		 */
		public ResamplingConfig build() {
			if (substepsPerPlaneGap < 1) {
				throw new IllegalArgumentException("substepsPerPlaneGap must be >= 1, got " + substepsPerPlaneGap);
			}
			if (rkOrder < 1 || rkOrder > 4) {
				throw new IllegalArgumentException("rkOrder must be in 1..4, got " + rkOrder);
			}
			if (nCrossSection < 1) {
				throw new IllegalArgumentException("nCrossSection must be >= 1, got " + nCrossSection);
			}
			if (!(accuracyTolerance > 0) || !Double.isFinite(accuracyTolerance)) {
				throw new IllegalArgumentException("accuracyTolerance must be positive, got " + accuracyTolerance);
			}
			Objects.requireNonNull(decomposition, "decomposition must not be null");
			Objects.requireNonNull(landingMethod, "landingMethod must not be null");
			return new ResamplingConfig(this);
		}
	}
}
