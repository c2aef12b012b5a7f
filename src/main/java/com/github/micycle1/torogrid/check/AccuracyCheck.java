package com.github.micycle1.torogrid.check;

import java.util.Collection;
import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.torogrid.data.Quantity;
import com.github.micycle1.torogrid.grid.Cartesian2D;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

/**
 * <p>
 * Self-check of a 2-D resampling: every gridded field is interpolated back
 * (bilinearly) to the mesh nodes lying strictly inside the grid and compared
 * with the original node values.
 * </p>
 *
 * <p>
 * A node violates the tolerance when |original - back| / |back| exceeds it and
 * |original| is above 1% of the largest |original| among the compared nodes;
 * below that the relative error of near-zero values is meaningless.
 * </p>
 * Violations are reported, never thrown.
 */
public final class AccuracyCheck {

	private static final Logger LOGGER = LoggerFactory.getLogger(AccuracyCheck.class);

	static final double SIGNIFICANCE = 1e-2;

	/** Per-node values, or per-grid-point values, of one quantity at one cross-section and timestep. */
	@FunctionalInterface
	public interface FieldSource {
		double[] get(Quantity q, int crossSection, int time);
	}

	private final UnstructuredMesh mesh;
	private final Cartesian2D grid;
	private final double tolerance;
	private final int[] inside;

	public AccuracyCheck(UnstructuredMesh mesh, Cartesian2D grid, double tolerance) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
		this.grid = Objects.requireNonNull(grid, "grid must not be null");
		if (!(tolerance > 0)) {
			throw new IllegalArgumentException("tolerance must be positive, got " + tolerance);
		}
		this.tolerance = tolerance;
		double[] r = grid.getR1D();
		double[] z = grid.getZ1D();
		inside = IntStream.range(0, mesh.getNodeCount()).filter(i -> {
			double ri = mesh.getR(i);
			double zi = mesh.getZ(i);
			return ri > r[0] && ri < r[r.length - 1] && zi > z[0] && zi < z[z.length - 1];
		}).toArray();
	}

	/** Number of mesh nodes that take part in each comparison. */
	public int getComparedNodeCount() {
		return inside.length;
	}

	public AccuracyReport check(Collection<Quantity> quantities, int crossSections, int times, FieldSource original, FieldSource gridded) {
		AccuracyReport.Builder report = new AccuracyReport.Builder(tolerance);
		for (Quantity q : quantities) {
			for (int c = 0; c < crossSections; c++) {
				for (int t = 0; t < times; t++) {
					compare(q, c, t, original.get(q, c, t), gridded.get(q, c, t), report);
				}
			}
		}
		AccuracyReport out = report.build();
		if (!out.getViolations().isEmpty()) {
			LOGGER.warn("Accuracy check at tolerance {}: {} violations, first {}", tolerance, out.getViolations().size(), out.getViolations().get(0));
		} else {
			LOGGER.info("Accuracy check at tolerance {} passed on {} nodes", tolerance, inside.length);
		}
		return out;
	}

	void compare(Quantity q, int crossSection, int time, double[] nodeValues, double[] gridValues, AccuracyReport.Builder report) {
		BilinearGridInterpolator back = new BilinearGridInterpolator(grid, gridValues);
		double maxAbs = 0;
		for (int i : inside) {
			maxAbs = Math.max(maxAbs, Math.abs(nodeValues[i]));
		}
		double floor = SIGNIFICANCE * maxAbs;
		for (int i : inside) {
			double r = mesh.getR(i);
			double z = mesh.getZ(i);
			double orig = nodeValues[i];
			double b = back.interpolate(r, z);
			double error = Math.abs((orig - b) / b);
			// NaN (0/0) never counts
			if (error > tolerance && Math.abs(orig) > floor) {
				report.add(new Violation(q, crossSection, time, i, r, z, orig, b, error));
			}
		}
		report.addChecked(q, inside.length);
	}
}
