package com.ospicorp.rentindex.forecast;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Unconstrained Nelder-Mead simplex minimizer. Non-finite objective values are treated as +inf.
 * A search that runs out of iterations is restarted from its best vertex with a fresh simplex,
 * up to {@code restarts} times.
 */
final class NelderMead {
  private static final double REFLECTION = 1.0;
  private static final double EXPANSION = 2.0;
  private static final double CONTRACTION = 0.5;
  private static final double SHRINK = 0.5;

  private final double relativeTolerance;
  private final double absoluteTolerance;
  private final double pointTolerance;
  private final int maxIterations;
  private final int restarts;

  NelderMead(double relativeTolerance, double absoluteTolerance, double pointTolerance,
      int maxIterations) {
    this(relativeTolerance, absoluteTolerance, pointTolerance, maxIterations, 0);
  }

  NelderMead(double relativeTolerance, double absoluteTolerance, double pointTolerance,
      int maxIterations, int restarts) {
    this.relativeTolerance = relativeTolerance;
    this.absoluteTolerance = absoluteTolerance;
    this.pointTolerance = pointTolerance;
    this.maxIterations = maxIterations;
    this.restarts = restarts;
  }

  record Result(double[] point, double value, int iterations, boolean converged) {}

  Result minimize(ToDoubleFunction<double[]> objective, double[] start, double step) {
    Result result = search(objective, start, step);
    int total = result.iterations();
    for (int round = 0; round < restarts && !result.converged(); round++) {
      result = search(objective, result.point(), step);
      total += result.iterations();
    }
    return new Result(result.point(), result.value(), total, result.converged());
  }

  private Result search(ToDoubleFunction<double[]> objective, double[] start, double step) {
    int dim = start.length;
    Vertex[] simplex = new Vertex[dim + 1];
    simplex[0] = vertex(objective, start.clone());
    for (int i = 0; i < dim; i++) {
      double[] p = start.clone();
      p[i] += step;
      simplex[i + 1] = vertex(objective, p);
    }

    int iteration = 0;
    while (true) {
      Arrays.sort(simplex, Comparator.comparingDouble(Vertex::value));
      if (hasConverged(simplex)) {
        return new Result(simplex[0].point(), simplex[0].value(), iteration, true);
      }
      if (iteration >= maxIterations) {
        return new Result(simplex[0].point(), simplex[0].value(), iteration, false);
      }
      iteration++;

      double[] centroid = new double[dim];
      for (int i = 0; i < dim; i++) {
        for (int d = 0; d < dim; d++) {
          centroid[d] += simplex[i].point()[d] / dim;
        }
      }
      Vertex worst = simplex[dim];
      Vertex reflected = vertex(objective, along(centroid, worst.point(), -REFLECTION));

      if (reflected.value() < simplex[0].value()) {
        Vertex expanded = vertex(objective, along(centroid, worst.point(), -EXPANSION));
        simplex[dim] = expanded.value() < reflected.value() ? expanded : reflected;
        continue;
      }
      if (reflected.value() < simplex[dim - 1].value()) {
        simplex[dim] = reflected;
        continue;
      }

      Vertex contracted;
      if (reflected.value() < worst.value()) {
        contracted = vertex(objective, along(centroid, reflected.point(), CONTRACTION));
        if (contracted.value() <= reflected.value()) {
          simplex[dim] = contracted;
          continue;
        }
      } else {
        contracted = vertex(objective, along(centroid, worst.point(), CONTRACTION));
        if (contracted.value() < worst.value()) {
          simplex[dim] = contracted;
          continue;
        }
      }

      double[] best = simplex[0].point();
      for (int i = 1; i <= dim; i++) {
        simplex[i] = vertex(objective, along(best, simplex[i].point(), SHRINK));
      }
    }
  }

  private boolean hasConverged(Vertex[] simplex) {
    double best = simplex[0].value();
    double spread = simplex[simplex.length - 1].value() - best;
    if (spread <= absoluteTolerance + relativeTolerance * Math.abs(best)) {
      return true;
    }
    double diameter = 0;
    for (int i = 1; i < simplex.length; i++) {
      for (int d = 0; d < simplex[0].point().length; d++) {
        diameter = Math.max(diameter, Math.abs(simplex[i].point()[d] - simplex[0].point()[d]));
      }
    }
    return Double.isFinite(best) && diameter <= pointTolerance;
  }

  // from + t * (to - from)
  private static double[] along(double[] from, double[] to, double t) {
    double[] out = new double[from.length];
    for (int d = 0; d < from.length; d++) {
      out[d] = from[d] + t * (to[d] - from[d]);
    }
    return out;
  }

  private static Vertex vertex(ToDoubleFunction<double[]> objective, double[] point) {
    double value = objective.applyAsDouble(point);
    return new Vertex(point, Double.isFinite(value) ? value : Double.POSITIVE_INFINITY);
  }

  private record Vertex(double[] point, double value) {}
}
