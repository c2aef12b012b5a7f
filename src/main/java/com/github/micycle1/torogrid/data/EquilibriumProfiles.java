package com.github.micycle1.torogrid.data;

/**
 * 1-D equilibrium temperature and density profiles tabulated against the
 * poloidal flux ψ. Outside the tabulated range Te falls back to min(Te)/2, Ti to
 * 0 and both densities to a tenth of their minimum.
 */
public final class EquilibriumProfiles {

	private final ProfileInterpolator te;
	private final ProfileInterpolator ti;
	private final ProfileInterpolator ne;
	private final ProfileInterpolator ni;

	public EquilibriumProfiles(double[] psi, double[] te, double[] ti, double[] ne, double[] ni) {
		this.te = new ProfileInterpolator(psi, te, min(te) / 2);
		this.ti = new ProfileInterpolator(psi, ti, 0.0);
		this.ne = new ProfileInterpolator(psi, ne, min(ne) / 10);
		this.ni = new ProfileInterpolator(psi, ni, min(ni) / 10);
	}

	public ProfileInterpolator getTe() {
		return te;
	}

	public ProfileInterpolator getTi() {
		return ti;
	}

	public ProfileInterpolator getNe() {
		return ne;
	}

	public ProfileInterpolator getNi() {
		return ni;
	}

	private static double min(double[] a) {
		if (a == null || a.length == 0) {
			throw new IllegalArgumentException("Profile values must not be empty");
		}
		double m = Double.POSITIVE_INFINITY;
		for (double v : a) {
			m = Math.min(m, v);
		}
		return m;
	}
}
