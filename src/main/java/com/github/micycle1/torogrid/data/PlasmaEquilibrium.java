package com.github.micycle1.torogrid.data;

import java.util.Objects;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.ResamplingConfig;

/**
 * Magnetic equilibrium plus the background temperature and density at every
 * mesh node, read from the 1-D profiles at the node ψ.
 */
public final class PlasmaEquilibrium {

	private final MagneticEquilibrium magnetic;
	private final EquilibriumProfiles profiles;
	private final double[] te0;
	private final double[] ti0;
	private final double[] ne0;
	private final double[] ni0;

	PlasmaEquilibrium(MagneticEquilibrium magnetic, EquilibriumProfiles profiles) {
		this.magnetic = Objects.requireNonNull(magnetic, "magnetic must not be null");
		this.profiles = Objects.requireNonNull(profiles, "profiles must not be null");
		double[] psi = magnetic.getSimulationMesh().getPsi();
		te0 = profiles.getTe().values(psi);
		ti0 = profiles.getTi().values(psi);
		ne0 = profiles.getNe().values(psi);
		ni0 = profiles.getNi().values(psi);
	}

	/**
	 * Attaches the fluctuation data and separates turbulence from relaxation as
	 * configured.
	 *
	 * @throws DataInconsistencyException if the fluctuation data do not fit the
	 *                                    mesh or the options
	 */
	public LoadedSimulationData withFluctuations(FluctuationData fluctuations, ResamplingConfig config) {
		return LoadedSimulationData.load(this, fluctuations, config);
	}

	public MagneticEquilibrium getMagnetic() {
		return magnetic;
	}

	public SimulationMesh getSimulationMesh() {
		return magnetic.getSimulationMesh();
	}

	public EquilibriumProfiles getProfiles() {
		return profiles;
	}

	public double[] getTe0() {
		return te0.clone();
	}

	public double[] getTi0() {
		return ti0.clone();
	}

	public double[] getNe0() {
		return ne0.clone();
	}

	public double[] getNi0() {
		return ni0.clone();
	}
}
