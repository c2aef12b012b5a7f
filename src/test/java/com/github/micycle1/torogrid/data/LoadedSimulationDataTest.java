package com.github.micycle1.torogrid.data;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.MeshFixtures;
import com.github.micycle1.torogrid.ResamplingConfig;
import com.github.micycle1.torogrid.ResamplingConfig.Decomposition;

public class LoadedSimulationDataTest {

	private static final int N = 9;

	private PlasmaEquilibrium equilibrium;

	@BeforeEach
	void setUp() {
		double[][] rz = MeshFixtures.lattice(0, 1, 3, 0, 1, 3);
		equilibrium = SimulationMesh.of(rz[0], rz[1], rz[0].clone(), MeshFixtures.noAdjacency(N))
				.withMagneticField(new double[N], new double[N], MeshFixtures.constant(N, 1))
				.withProfiles(MeshFixtures.flatProfiles());
	}

	// two planes at mean +- amplitude, one timestep
	private static double[][][] pair(double mean, double amplitude) {
		return new double[][][] { { MeshFixtures.constant(N, mean + amplitude) }, { MeshFixtures.constant(N, mean - amplitude) } };
	}

	@Test
	void evaluatesTheEquilibriumAtTheNodes() {
		MagneticEquilibrium field = equilibrium.getMagnetic();
		assertTrue(field.isCoDirectional());
		for (int i = 0; i < N; i++) {
			assertEquals(0, field.getBR(i), 0);
			assertEquals(0, field.getBZ(i), 0);
			assertEquals(1, field.getBPhi(i), 0);
			assertEquals(1, field.getBTotal(i), 0);
			assertEquals(1, equilibrium.getTe0()[i], 0);
			assertEquals(1, equilibrium.getTi0()[i], 0);
			assertEquals(2, equilibrium.getNi0()[i], 0);
		}
	}

	@Test
	void derivesPreviousNodes() {
		assertArrayEquals(new int[] { -1, 0, 1, -1 }, SimulationMesh.derivePrevNode(new int[] { 1, 2, -1, 2 }));
	}

	@Test
	void foldsRelaxationIntoTheEquilibrium() {
		FluctuationData raw = FluctuationData.builder().potential(pair(0.1, 0.05)).electronDensity(pair(0.3, 0.2)).ionDensity(pair(0.05, 0.01))
				.build();
		ResamplingConfig config = ResamplingConfig.builder().loadIons(true).build();
		LoadedSimulationData data = equilibrium.withFluctuations(raw, config);

		assertEquals(2, data.getPlaneCount());
		assertEquals(1, data.getTimeCount());
		assertEquals(4, data.getQuantities().size());
		for (int i = 0; i < N; i++) {
			assertEquals(0.1, data.getPhi0()[i], 1e-12);
			// n0 + <dn> + <phi>
			assertEquals(2 + 0.3 + 0.1, data.getNe0()[i], 1e-12);
			assertEquals(2 + 0.05 + 0.1, data.getNi0()[i], 1e-12);
		}
		assertEquals(0.05, data.getPlaneField(Quantity.POTENTIAL, 0, 0)[4], 1e-12);
		assertEquals(-0.2, data.getPlaneField(Quantity.NONADIABATIC_ELECTRON_DENSITY, 1, 0)[4], 1e-12);
		assertEquals(0.01, data.getPlaneField(Quantity.ION_DENSITY, 0, 0)[4], 1e-12);
		// adiabatic response uses the updated density
		assertEquals(2.4 * 0.05, data.getPlaneField(Quantity.ADIABATIC_ELECTRON_DENSITY, 0, 0)[4], 1e-12);
		// the equilibrium itself is untouched
		assertEquals(2, equilibrium.getNe0()[0], 0);
	}

	@Test
	void potentialRelaxationIsNotScaledByTemperature() {
		double[][] rz = MeshFixtures.lattice(0, 1, 3, 0, 1, 3);
		EquilibriumProfiles hot = new EquilibriumProfiles(new double[] { -10, 10 }, new double[] { 4, 4 }, new double[] { 1, 1 },
				new double[] { 2, 2 }, new double[] { 2, 2 });
		PlasmaEquilibrium eq = SimulationMesh.of(rz[0], rz[1], rz[0].clone(), MeshFixtures.noAdjacency(N))
				.withMagneticField(new double[N], new double[N], MeshFixtures.constant(N, 1)).withProfiles(hot);
		FluctuationData raw = FluctuationData.builder().potential(pair(0.5, 0)).build();
		LoadedSimulationData data = eq.withFluctuations(raw, ResamplingConfig.builder().hasElectronDynamics(false).build());

		for (int i = 0; i < N; i++) {
			assertEquals(0.5, data.getPhi0()[i], 1e-12);
			assertEquals(2.5, data.getNe0()[i], 1e-12);
			assertEquals(2.5, data.getNi0()[i], 1e-12);
			// nothing is left over once the toroidal average is removed
			assertEquals(0, data.getPlaneField(Quantity.ADIABATIC_ELECTRON_DENSITY, 1, 0)[i], 1e-12);
		}
	}

	@Test
	void meanSubtractionKeepsTheEquilibrium() {
		FluctuationData raw = FluctuationData.builder().potential(pair(0.1, 0.05)).build();
		ResamplingConfig config = ResamplingConfig.builder().hasElectronDynamics(false).decomposition(Decomposition.MEAN_SUBTRACTION).build();
		LoadedSimulationData data = equilibrium.withFluctuations(raw, config);

		assertEquals(0, data.getPhi0()[3], 0);
		assertEquals(2, data.getNe0()[3], 0);
		assertEquals(0.05, data.getPlaneField(Quantity.POTENTIAL, 0, 0)[3], 1e-12);
		assertFalse(data.getQuantities().contains(Quantity.NONADIABATIC_ELECTRON_DENSITY));
		assertTrue(data.getQuantities().contains(Quantity.ADIABATIC_ELECTRON_DENSITY));
	}

	@Test
	void filterZeroesOversizedDensityFluctuations() {
		FluctuationData raw = FluctuationData.builder().potential(pair(0, 5)).electronDensity(pair(0, 0.5)).build();
		ResamplingConfig config = ResamplingConfig.builder().applyRelaxationFilter(true).build();
		LoadedSimulationData data = equilibrium.withFluctuations(raw, config);

		// adiabatic response 2 * 5 / 1 exceeds ne0 = 2 everywhere; non-adiabatic 0.5 does not
		assertEquals(2 * N, data.getFilteredCount());
		assertEquals(0, data.getPlaneField(Quantity.ADIABATIC_ELECTRON_DENSITY, 0, 0)[0], 0);
		assertEquals(0.5, data.getPlaneField(Quantity.NONADIABATIC_ELECTRON_DENSITY, 0, 0)[0], 1e-12);
		// the potential is never filtered
		assertEquals(5, data.getPlaneField(Quantity.POTENTIAL, 0, 0)[0], 1e-12);
	}

	@Test
	void centrePlanesAreEvenlySpaced() {
		assertArrayEquals(new int[] { 0, 5, 10 }, LoadedSimulationData.centerPlanes(16, 3));
		assertArrayEquals(new int[] { 0 }, LoadedSimulationData.centerPlanes(4, 1));
	}

	@Test
	void inconsistentDataIsRejectedUpFront() {
		ResamplingConfig noElectrons = ResamplingConfig.builder().hasElectronDynamics(false).build();

		FluctuationData wrongNodes = FluctuationData.builder().potential(new double[][][] { { new double[4] } }).build();
		assertThrows(DataInconsistencyException.class, () -> equilibrium.withFluctuations(wrongNodes, noElectrons));

		FluctuationData potentialOnly = FluctuationData.builder().potential(pair(0, 1)).build();
		assertThrows(DataInconsistencyException.class, () -> equilibrium.withFluctuations(potentialOnly, ResamplingConfig.defaults()));
		assertThrows(DataInconsistencyException.class,
				() -> equilibrium.withFluctuations(potentialOnly, noElectrons.toBuilder().loadIons(true).build()));
		assertThrows(DataInconsistencyException.class,
				() -> equilibrium.withFluctuations(potentialOnly, noElectrons.toBuilder().nCrossSection(3).build()));

		assertThrows(DataInconsistencyException.class, () -> FluctuationData.builder().ionDensity(pair(0, 1)).build());
		assertThrows(DataInconsistencyException.class,
				() -> FluctuationData.builder().potential(pair(0, 1)).electronDensity(new double[][][] { { new double[N] } }).build());
		assertThrows(DataInconsistencyException.class,
				() -> FluctuationData.builder().potential(new double[][][] { { new double[N] }, { new double[N], new double[N] } }).build());
	}

	@Test
	void rejectsMismatchedNodeArrays() {
		SimulationMesh mesh = equilibrium.getSimulationMesh();
		assertThrows(DataInconsistencyException.class, () -> mesh.withMagneticField(new double[N], new double[N], new double[N - 1]));
		double[][] rz = MeshFixtures.lattice(0, 1, 3, 0, 1, 3);
		assertThrows(DataInconsistencyException.class, () -> SimulationMesh.of(rz[0], rz[1], new double[N], new int[] { 0 }));
		int[] next = MeshFixtures.noAdjacency(N);
		next[2] = N;
		assertThrows(DataInconsistencyException.class, () -> SimulationMesh.of(rz[0], rz[1], new double[N], next));
	}
}
