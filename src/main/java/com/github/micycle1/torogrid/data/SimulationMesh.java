package com.github.micycle1.torogrid.data;

import java.util.Arrays;
import java.util.Objects;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

/**
 * <p>
 * The simulation's poloidal mesh together with the per-node poloidal flux ψ and
 * the along-field node adjacency.
 * </p>
 *
 * <p>
 * {@code nextNode[i]} is the node reached from node i by following the field
 * line to the next simulation plane; -1 where there is none. The reverse map
 * {@code prevNode} is derived once here: {@code prevNode[i]} is the lowest
 * index j with {@code nextNode[j] == i}, or -1 when no node leads to i.
 * </p>
 *
 * This is the first stage of loading; {@link #withMagneticField} adds the
 * equilibrium field.
 */
public final class SimulationMesh {

	private final UnstructuredMesh mesh;
	private final double[] psi;
	private final int[] nextNode;
	private final int[] prevNode;
	private final CloughTocherInterpolant psiInterpolant;
	private final double psiMax;

	public static SimulationMesh of(double[] r, double[] z, double[] psi, int[] nextNode) {
		return new SimulationMesh(UnstructuredMesh.of(r, z), psi, nextNode);
	}

	/**
	 * @throws DataInconsistencyException if the node arrays do not match the mesh
	 */
	public SimulationMesh(UnstructuredMesh mesh, double[] psi, int[] nextNode) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
		Objects.requireNonNull(psi, "psi must not be null");
		Objects.requireNonNull(nextNode, "nextNode must not be null");
		int n = mesh.getNodeCount();
		DataInconsistencyException.require(psi.length == n, "psi has %d values for %d mesh nodes", psi.length, n);
		DataInconsistencyException.require(nextNode.length == n, "nextNode has %d entries for %d mesh nodes", nextNode.length, n);
		for (int i = 0; i < n; i++) {
			DataInconsistencyException.require(nextNode[i] >= -1 && nextNode[i] < n, "nextNode[%d] = %d is not a node index", i, nextNode[i]);
		}
		this.psi = psi.clone();
		this.nextNode = nextNode.clone();
		this.prevNode = derivePrevNode(nextNode);
		this.psiInterpolant = mesh.interpolant(psi);
		this.psiMax = Arrays.stream(psi).max().orElse(0);
	}

	static int[] derivePrevNode(int[] nextNode) {
		int[] prev = new int[nextNode.length];
		Arrays.fill(prev, -1);
		for (int j = 0; j < nextNode.length; j++) {
			int target = nextNode[j];
			if (target >= 0 && prev[target] == -1) {
				prev[target] = j;
			}
		}
		return prev;
	}

	/**
	 * Adds the equilibrium magnetic field given per node.
	 *
	 * @throws DataInconsistencyException on a node count mismatch
	 */
	public MagneticEquilibrium withMagneticField(double[] bR, double[] bZ, double[] bPhi) {
		return new MagneticEquilibrium(this, bR, bZ, bPhi);
	}

	public UnstructuredMesh getMesh() {
		return mesh;
	}

	public int getNodeCount() {
		return psi.length;
	}

	public double getPsi(int node) {
		return psi[node];
	}

	public double[] getPsi() {
		return psi.clone();
	}

	public double getPsiMax() {
		return psiMax;
	}

	public int getNextNode(int node) {
		return nextNode[node];
	}

	/** Node leading to the given node along the field, or -1. */
	public int getPrevNode(int node) {
		return prevNode[node];
	}

	public CloughTocherInterpolant getPsiInterpolant() {
		return psiInterpolant;
	}
}
