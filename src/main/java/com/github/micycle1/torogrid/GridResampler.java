package com.github.micycle1.torogrid;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.torogrid.ResamplingConfig.LandingMethod;
import com.github.micycle1.torogrid.check.AccuracyCheck;
import com.github.micycle1.torogrid.check.AccuracyReport;
import com.github.micycle1.torogrid.data.EquilibriumProfiles;
import com.github.micycle1.torogrid.data.LoadedSimulationData;
import com.github.micycle1.torogrid.data.MagneticEquilibrium;
import com.github.micycle1.torogrid.data.PlasmaEquilibrium;
import com.github.micycle1.torogrid.data.Quantity;
import com.github.micycle1.torogrid.data.SimulationMesh;
import com.github.micycle1.torogrid.grid.Cartesian2D;
import com.github.micycle1.torogrid.grid.StructuredGrid;
import com.github.micycle1.torogrid.grid.ToroidalGrid;
import com.github.micycle1.torogrid.interp.BoundaryExtrapolator;
import com.github.micycle1.torogrid.interp.PlaneBlender;
import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;
import com.github.micycle1.torogrid.mesh.MaskedValues;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;
import com.github.micycle1.torogrid.tracing.ButcherTableau;
import com.github.micycle1.torogrid.tracing.FieldLineTracer;
import com.github.micycle1.torogrid.tracing.LandingPositions;
import com.github.micycle1.torogrid.tracing.NodeAdjacencyLandingEstimator;
import com.github.micycle1.torogrid.tracing.PlaneIndexTable;

/**
 * <p>
 * Resamples loaded simulation data onto a structured grid.
 * </p>
 *
 * <p>
 * On a 2-D (R,Z) grid each cross-section's centre plane is interpolated
 * directly and the result is checked by back-interpolation to the mesh nodes.
 * On a 3-D grid every point is followed along the field to its two bracketing
 * planes and the plane values there are blended by field-line length; no
 * accuracy check is possible since the planes do not coincide with grid
 * slices. Either way the equilibrium is written to the grid, extrapolated
 * outside the mesh.
 * </p>
 *
 * <pre>
 * LoadedSimulationData data = SimulationMesh.of(r, z, psi, nextNode)
 * 		.withMagneticField(bR, bZ, bPhi)
 * 		.withProfiles(profiles)
 * 		.withFluctuations(fluctuations, config);
 * GriddedFields out = new GridResampler(data).resample(new Cartesian3D(...));
 * </pre>
 *
 * A resampler holds no state between passes; each call returns fresh arrays.
 */
public final class GridResampler {

	private static final Logger LOGGER = LoggerFactory.getLogger(GridResampler.class);

	private final LoadedSimulationData data;
	private final ResamplingConfig config;
	private final UnstructuredMesh mesh;
	private final BoundaryExtrapolator extrapolator;

	public GridResampler(LoadedSimulationData data) {
		this.data = Objects.requireNonNull(data, "data must not be null");
		this.config = data.getConfig();
		this.mesh = data.getEquilibrium().getSimulationMesh().getMesh();
		this.extrapolator = new BoundaryExtrapolator(mesh);
	}

	/**
	 * @throws MeshConstructionException  if a 3-D grid carries no toroidal angle
	 * @throws DataInconsistencyException if the data cannot serve the grid
	 */
	public GriddedFields resample(StructuredGrid grid) {
		Objects.requireNonNull(grid, "grid must not be null");
		validate(grid);
		long start = System.nanoTime();
		int n = grid.size();
		double[] r = new double[n];
		double[] z = new double[n];
		for (int i = 0; i < n; i++) {
			r[i] = grid.getR(i);
			z[i] = grid.getZ(i);
		}

		Map<Quantity, MaskedValues[][]> fluctuations;
		if (grid.getDimension() == 2) {
			fluctuations = resample2D(r, z);
		} else {
			fluctuations = resample3D((ToroidalGrid) grid, r, z);
		}
		Map<EquilibriumQuantity, double[]> equilibrium = equilibrium(grid, r, z);
		GriddedFields out = new GriddedFields(grid, fluctuations, equilibrium, AccuracyReport.notApplicable(config.getAccuracyTolerance()));
		if (grid instanceof Cartesian2D) {
			out = out.withAccuracy(checkAccuracy(out, config.getAccuracyTolerance()));
		}
		LOGGER.info("Resampled {} quantities x {} cross-sections x {} timesteps onto {} in {} ms", fluctuations.size(),
				data.getCrossSectionCount(), data.getTimeCount(), grid, (System.nanoTime() - start) / 1_000_000);
		return out;
	}

	/**
	 * Compares gridded fluctuations with the original node values at the given
	 * tolerance. Only 2-D Cartesian grids can be checked.
	 */
	public AccuracyReport checkAccuracy(GriddedFields fields, double tolerance) {
		if (!(fields.getGrid() instanceof Cartesian2D)) {
			LOGGER.info("Accuracy check skipped: planes do not coincide with slices of {}", fields.getGrid());
			return AccuracyReport.notApplicable(tolerance);
		}
		AccuracyCheck check = new AccuracyCheck(mesh, (Cartesian2D) fields.getGrid(), tolerance);
		return check.check(fields.getQuantities(), fields.getCrossSectionCount(), fields.getTimeCount(),
				(q, c, t) -> data.getPlaneField(q, data.getCenterPlane(c), t), (q, c, t) -> fields.getValues(q, c, t, 0));
	}

	private void validate(StructuredGrid grid) {
		int dim = grid.getDimension();
		if (dim != 2 && dim != 3) {
			throw new MeshConstructionException("Grid dimension must be 2 or 3, got " + dim);
		}
		if (dim == 3 && !(grid instanceof ToroidalGrid)) {
			throw new MeshConstructionException("A 3-D grid must provide toroidal angles: " + grid.getClass().getName());
		}
		DataInconsistencyException.require(grid.size() > 0, "Grid has no points");
		DataInconsistencyException.require(data.getPlaneCount() >= 1, "No simulation planes loaded");
		DataInconsistencyException.require(data.getTimeCount() >= 1, "No timesteps loaded");
		DataInconsistencyException.require(data.getCrossSectionCount() <= data.getPlaneCount(), "%d cross-sections requested from %d planes",
				data.getCrossSectionCount(), data.getPlaneCount());
	}

	private Map<Quantity, MaskedValues[][]> resample2D(double[] r, double[] z) {
		Map<Quantity, MaskedValues[][]> out = new EnumMap<>(Quantity.class);
		int crossSections = data.getCrossSectionCount();
		int times = data.getTimeCount();
		for (Quantity q : data.getQuantities()) {
			MaskedValues[][] f = new MaskedValues[crossSections][times];
			for (int c = 0; c < crossSections; c++) {
				int plane = data.getCenterPlane(c);
				for (int t = 0; t < times; t++) {
					CloughTocherInterpolant interp = mesh.interpolant(data.getPlaneField(q, plane, t));
					f[c][t] = MaskedValues.allDefined(interp.evaluate(r, z).filled(0));
				}
				LOGGER.debug("{} on plane {} interpolated for {} timesteps", q, plane, times);
			}
			out.put(q, f);
		}
		return out;
	}

	private Map<Quantity, MaskedValues[][]> resample3D(ToroidalGrid grid, double[] r, double[] z) {
		PlasmaEquilibrium eq = data.getEquilibrium();
		MagneticEquilibrium field = eq.getMagnetic();
		int planeCount = data.getPlaneCount();
		PlaneIndexTable planes = new PlaneIndexTable(grid, planeCount, field.isCoDirectional());

		LandingPositions landing;
		if (config.getLandingMethod() == LandingMethod.FIELD_LINE) {
			FieldLineTracer tracer = new FieldLineTracer(field, ButcherTableau.ofOrder(config.getRkOrder()), config.getSubstepsPerPlaneGap(),
					config.isParallel());
			landing = tracer.trace(r, z, planes);
		} else {
			landing = new NodeAdjacencyLandingEstimator(eq.getSimulationMesh()).estimate(r, z, planes);
		}
		LOGGER.debug("Landing positions found for {} points ({}), {} undefined", landing.size(), config.getLandingMethod(),
				landing.undefinedCount());

		Map<Quantity, MaskedValues[][]> out = new EnumMap<>(Quantity.class);
		int crossSections = data.getCrossSectionCount();
		int times = data.getTimeCount();
		for (Quantity q : data.getQuantities()) {
			MaskedValues[][] f = new MaskedValues[crossSections][times];
			for (int t = 0; t < times; t++) {
				int time = t;
				PlaneBlender blender = new PlaneBlender(mesh, plane -> data.getPlaneField(q, plane, time), planeCount, config.isParallel());
				for (int c = 0; c < crossSections; c++) {
					f[c][t] = blender.blend(landing, planes, data.getCenterPlane(c));
				}
			}
			LOGGER.debug("{} blended for {} cross-sections x {} timesteps", q, crossSections, times);
			out.put(q, f);
		}
		return out;
	}

	private Map<EquilibriumQuantity, double[]> equilibrium(StructuredGrid grid, double[] r, double[] z) {
		PlasmaEquilibrium eq = data.getEquilibrium();
		SimulationMesh simMesh = eq.getSimulationMesh();
		MagneticEquilibrium field = eq.getMagnetic();
		Map<EquilibriumQuantity, double[]> out = new EnumMap<>(EquilibriumQuantity.class);

		double[] psi = extrapolator.evaluate(simMesh.getPsiInterpolant(), r, z);
		double[] bR = extrapolator.evaluate(field.getBRInterpolant(), r, z);
		double[] bZ = extrapolator.evaluate(field.getBZInterpolant(), r, z);
		double[] bPhi = extrapolator.evaluate(field.getBPhiInterpolant(), r, z);
		out.put(EquilibriumQuantity.PSI, psi);
		out.put(EquilibriumQuantity.B_R, bR);
		out.put(EquilibriumQuantity.B_Z, bZ);
		out.put(EquilibriumQuantity.B_PHI, bPhi);
		out.put(EquilibriumQuantity.B_TOTAL, magnitude(bR, bZ, bPhi));

		if (grid instanceof ToroidalGrid) {
			ToroidalGrid tg = (ToroidalGrid) grid;
			int n = r.length;
			double[] bx = new double[n];
			double[] by = new double[n];
			double[] bz = new double[n];
			for (int i = 0; i < n; i++) {
				double cos = Math.cos(tg.getPhi(i));
				double sin = Math.sin(tg.getPhi(i));
				// e_R = (cos, 0, -sin), e_phi = (-sin, 0, -cos), e_z = (0, 1, 0)
				bx[i] = bR[i] * cos - bPhi[i] * sin;
				by[i] = bZ[i];
				bz[i] = -bR[i] * sin - bPhi[i] * cos;
			}
			out.put(EquilibriumQuantity.B_X, bx);
			out.put(EquilibriumQuantity.B_Y, by);
			out.put(EquilibriumQuantity.B_CARTESIAN_Z, bz);
		}

		EquilibriumProfiles profiles = eq.getProfiles();
		out.put(EquilibriumQuantity.TE0, profiles.getTe().values(psi));
		out.put(EquilibriumQuantity.TI0, profiles.getTi().values(psi));
		out.put(EquilibriumQuantity.NE0, withRelaxation(profiles.getNe().values(psi), data.getNe0(), eq.getNe0(), r, z));
		out.put(EquilibriumQuantity.NI0, withRelaxation(profiles.getNi().values(psi), data.getNi0(), eq.getNi0(), r, z));
		return out;
	}

	private static double[] magnitude(double[] bR, double[] bZ, double[] bPhi) {
		double[] b = new double[bR.length];
		for (int i = 0; i < b.length; i++) {
			b[i] = Math.sqrt(bR[i] * bR[i] + bZ[i] * bZ[i] + bPhi[i] * bPhi[i]);
		}
		return b;
	}

	// profile density plus the interpolated relaxation; no relaxation outside the mesh
	private double[] withRelaxation(double[] profile, double[] effective, double[] original, double[] r, double[] z) {
		double[] delta = new double[effective.length];
		for (int i = 0; i < delta.length; i++) {
			delta[i] = effective[i] - original[i];
		}
		double[] correction = mesh.interpolant(delta).evaluate(r, z).filled(0);
		for (int i = 0; i < profile.length; i++) {
			profile[i] += correction[i];
		}
		return profile;
	}
}
