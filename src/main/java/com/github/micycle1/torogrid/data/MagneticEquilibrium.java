package com.github.micycle1.torogrid.data;

import java.util.Objects;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;

/**
 * Equilibrium magnetic field on the simulation mesh: the cylindrical components
 * B<sub>R</sub>, B<sub>Z</sub>, B<sub>φ</sub> per node with a C¹ interpolant of
 * each, and the field magnitude per node.
 * <p>
 * The toroidal field is co-directional with increasing φ when
 * B<sub>φ</sub> &gt; 0 at node 0; the whole field is assumed to keep that sign.
 */
public final class MagneticEquilibrium {

	private final SimulationMesh mesh;
	private final double[] bR;
	private final double[] bZ;
	private final double[] bPhi;
	private final double[] bTotal;
	private final CloughTocherInterpolant bRInterpolant;
	private final CloughTocherInterpolant bZInterpolant;
	private final CloughTocherInterpolant bPhiInterpolant;

	MagneticEquilibrium(SimulationMesh mesh, double[] bR, double[] bZ, double[] bPhi) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
		int n = mesh.getNodeCount();
		requireNodes(bR, n, "B_R");
		requireNodes(bZ, n, "B_Z");
		requireNodes(bPhi, n, "B_phi");
		this.bR = bR.clone();
		this.bZ = bZ.clone();
		this.bPhi = bPhi.clone();
		bTotal = new double[n];
		for (int i = 0; i < n; i++) {
			bTotal[i] = Math.sqrt(bR[i] * bR[i] + bZ[i] * bZ[i] + bPhi[i] * bPhi[i]);
		}
		bRInterpolant = mesh.getMesh().interpolant(this.bR);
		bZInterpolant = mesh.getMesh().interpolant(this.bZ);
		bPhiInterpolant = mesh.getMesh().interpolant(this.bPhi);
	}

	private static void requireNodes(double[] values, int n, String name) {
		Objects.requireNonNull(values, name + " must not be null");
		DataInconsistencyException.require(values.length == n, "%s has %d values for %d mesh nodes", name, values.length, n);
	}

	/** Adds the 1-D temperature and density profiles. */
	public PlasmaEquilibrium withProfiles(EquilibriumProfiles profiles) {
		return new PlasmaEquilibrium(this, profiles);
	}

	public SimulationMesh getSimulationMesh() {
		return mesh;
	}

	public boolean isCoDirectional() {
		return bPhi[0] > 0;
	}

	public double getBR(int node) {
		return bR[node];
	}

	public double getBZ(int node) {
		return bZ[node];
	}

	public double getBPhi(int node) {
		return bPhi[node];
	}

	public double getBTotal(int node) {
		return bTotal[node];
	}

	public CloughTocherInterpolant getBRInterpolant() {
		return bRInterpolant;
	}

	public CloughTocherInterpolant getBZInterpolant() {
		return bZInterpolant;
	}

	public CloughTocherInterpolant getBPhiInterpolant() {
		return bPhiInterpolant;
	}
}
