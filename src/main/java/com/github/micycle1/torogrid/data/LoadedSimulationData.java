package com.github.micycle1.torogrid.data;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.ResamplingConfig;
import com.github.micycle1.torogrid.ResamplingConfig.Decomposition;
import com.github.micycle1.torogrid.decomposition.AdiabaticResponse;
import com.github.micycle1.torogrid.decomposition.FluctuationFilter;
import com.github.micycle1.torogrid.decomposition.RelaxationDecomposition;

/**
 * <p>
 * Fully loaded simulation state handed to the resampler: the equilibrium, the
 * decomposed turbulent fluctuation of every quantity on every plane and
 * timestep, and the equilibrium densities updated with the relaxation that was
 * taken out of the fluctuations.
 * </p>
 *
 * <p>
 * With {@link Decomposition#TOROIDAL_AVERAGE} the time-averaged toroidal mean
 * of each perturbation is folded back:
 * </p>
 * <ul>
 * <li>ne0' = ne0 + &lt;δn<sub>e</sub>&gt; + &lt;φ&gt;</li>
 * <li>ni0' = ni0 + &lt;δn<sub>i</sub>&gt; + &lt;φ&gt;</li>
 * <li>phi0 = &lt;φ&gt;</li>
 * </ul>
 * The adiabatic electron response is computed from the centred potential and
 * ne0'. Quantities present: potential and adiabatic electron density always,
 * non-adiabatic electron density with electron dynamics, ion density when ions
 * are loaded.
 */
public final class LoadedSimulationData {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoadedSimulationData.class);

	private final PlasmaEquilibrium equilibrium;
	private final ResamplingConfig config;
	private final Map<Quantity, double[][][]> fields;
	private final double[] ne0;
	private final double[] ni0;
	private final double[] phi0;
	private final int[] centerPlanes;
	private final int planeCount;
	private final int timeCount;
	private final int filteredCount;

	private LoadedSimulationData(PlasmaEquilibrium equilibrium, ResamplingConfig config, Map<Quantity, double[][][]> fields, double[] ne0,
			double[] ni0, double[] phi0, int filteredCount) {
		this.equilibrium = equilibrium;
		this.config = config;
		this.fields = fields;
		this.ne0 = ne0;
		this.ni0 = ni0;
		this.phi0 = phi0;
		this.filteredCount = filteredCount;
		double[][][] pot = fields.get(Quantity.POTENTIAL);
		planeCount = pot.length;
		timeCount = pot[0].length;
		centerPlanes = centerPlanes(planeCount, config.getNCrossSection());
	}

	/** Centre plane of cross-section k: k · (P / n), integer division. */
	static int[] centerPlanes(int planeCount, int nCrossSection) {
		int[] c = new int[nCrossSection];
		int stride = planeCount / nCrossSection;
		for (int k = 0; k < nCrossSection; k++) {
			c[k] = k * stride;
		}
		return c;
	}

	static LoadedSimulationData load(PlasmaEquilibrium eq, FluctuationData data, ResamplingConfig config) {
		Objects.requireNonNull(data, "fluctuations must not be null");
		Objects.requireNonNull(config, "config must not be null");
		int nodes = eq.getSimulationMesh().getNodeCount();
		DataInconsistencyException.require(data.getNodeCount() == nodes, "Fluctuation data have %d nodes, mesh has %d", data.getNodeCount(), nodes);
		DataInconsistencyException.require(!config.hasElectronDynamics() || data.has(Quantity.NONADIABATIC_ELECTRON_DENSITY),
				"Electron dynamics enabled but no non-adiabatic electron density supplied");
		DataInconsistencyException.require(!config.loadIons() || data.has(Quantity.ION_DENSITY), "Ion loading enabled but no ion density supplied");
		DataInconsistencyException.require(config.getNCrossSection() <= data.getPlaneCount(), "%d cross-sections requested from %d planes",
				config.getNCrossSection(), data.getPlaneCount());

		double[] te0 = eq.getTe0();
		double[] ne0 = eq.getNe0();
		double[] ni0 = eq.getNi0();
		double[] phi0 = new double[nodes];
		Map<Quantity, double[][][]> out = new EnumMap<>(Quantity.class);

		double[][][] potential = data.raw(Quantity.POTENTIAL);
		if (config.getDecomposition() == Decomposition.TOROIDAL_AVERAGE) {
			double[][] potentialAvg = RelaxationDecomposition.toroidalAverage(potential);
			phi0 = RelaxationDecomposition.timeAverage(potentialAvg);
			out.put(Quantity.POTENTIAL, RelaxationDecomposition.removeToroidalAverage(potential));
			// the potential relaxation enters both densities unscaled
			add(ne0, phi0);
			add(ni0, phi0);
			if (config.hasElectronDynamics()) {
				double[][][] dne = data.raw(Quantity.NONADIABATIC_ELECTRON_DENSITY);
				add(ne0, RelaxationDecomposition.timeAverage(RelaxationDecomposition.toroidalAverage(dne)));
				out.put(Quantity.NONADIABATIC_ELECTRON_DENSITY, RelaxationDecomposition.removeToroidalAverage(dne));
			}
			if (config.loadIons()) {
				double[][][] dni = data.raw(Quantity.ION_DENSITY);
				add(ni0, RelaxationDecomposition.timeAverage(RelaxationDecomposition.toroidalAverage(dni)));
				out.put(Quantity.ION_DENSITY, RelaxationDecomposition.removeToroidalAverage(dni));
			}
		} else {
			out.put(Quantity.POTENTIAL, RelaxationDecomposition.removeTimestepMean(potential));
			if (config.hasElectronDynamics()) {
				out.put(Quantity.NONADIABATIC_ELECTRON_DENSITY,
						RelaxationDecomposition.removeTimestepMean(data.raw(Quantity.NONADIABATIC_ELECTRON_DENSITY)));
			}
			if (config.loadIons()) {
				out.put(Quantity.ION_DENSITY, RelaxationDecomposition.removeTimestepMean(data.raw(Quantity.ION_DENSITY)));
			}
		}
		out.put(Quantity.ADIABATIC_ELECTRON_DENSITY, AdiabaticResponse.compute(out.get(Quantity.POTENTIAL), ne0, te0));

		int filtered = 0;
		if (config.applyRelaxationFilter()) {
			for (Map.Entry<Quantity, double[][][]> e : out.entrySet()) {
				if (e.getKey().isDensity()) {
					filtered += FluctuationFilter.apply(e.getValue(), e.getKey() == Quantity.ION_DENSITY ? ni0 : ne0);
				}
			}
			LOGGER.debug("Relaxation filter zeroed {} density values", filtered);
		}

		LOGGER.info("Loaded {} planes x {} timesteps on {} nodes ({}, {})", data.getPlaneCount(), data.getTimeCount(), nodes, out.keySet(),
				config.getDecomposition());
		return new LoadedSimulationData(eq, config, out, ne0, ni0, phi0, filtered);
	}

	private static void add(double[] target, double[] delta) {
		for (int i = 0; i < target.length; i++) {
			target[i] += delta[i];
		}
	}

	public PlasmaEquilibrium getEquilibrium() {
		return equilibrium;
	}

	public ResamplingConfig getConfig() {
		return config;
	}

	public Set<Quantity> getQuantities() {
		return Collections.unmodifiableSet(fields.keySet());
	}

	/** Copy of the decomposed fluctuation of q on one plane at one timestep. */
	public double[] getPlaneField(Quantity q, int plane, int time) {
		double[][][] f = fields.get(q);
		if (f == null) {
			throw new IllegalArgumentException(q + " is not loaded");
		}
		return f[plane][time].clone();
	}

	public int getPlaneCount() {
		return planeCount;
	}

	public int getTimeCount() {
		return timeCount;
	}

	public int getCrossSectionCount() {
		return centerPlanes.length;
	}

	public int getCenterPlane(int crossSection) {
		return centerPlanes[crossSection];
	}

	/** Electron density with the relaxation folded in. */
	public double[] getNe0() {
		return ne0.clone();
	}

	/** Ion density with the relaxation folded in. */
	public double[] getNi0() {
		return ni0.clone();
	}

	/** Time- and toroidally averaged potential; zero in mean-subtraction mode. */
	public double[] getPhi0() {
		return phi0.clone();
	}

	/** Density values zeroed by the relaxation filter. */
	public int getFilteredCount() {
		return filteredCount;
	}
}
