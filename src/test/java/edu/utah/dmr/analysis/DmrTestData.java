package edu.utah.dmr.analysis;

import java.util.Random;

import edu.utah.dmr.data.Site;

/**Builds small datasets for the region calling tests.*/
public class DmrTestData {

	/**Row i of an 8 x 8 Sylvester Hadamard matrix, rows 1-7 have mean zero and are mutually orthogonal.*/
	static double[] hadamardRow(int row) {
		double[] r = new double[8];
		for (int j=0; j< 8; j++) r[j] = (Integer.bitCount(row & j) % 2 == 0) ? 1 : -1;
		return r;
	}

	/**Beta like measurements, 0.5 +/- 0.25, whose neighbors within 6 sites are exactly uncorrelated.*/
	static double[][] uncorrelatedMatrix(int numberSites) {
		double[][] m = new double[numberSites][];
		for (int i=0; i< numberSites; i++) {
			double[] h = hadamardRow(1 + (i % 7));
			for (int j=0; j< h.length; j++) h[j] = 0.5 + 0.25 * h[j];
			m[i] = h;
		}
		return m;
	}

	/**Ten sites on chromosome 1, 100bp apart starting at 100.  Sites 2-5 carry a strong effect, 
	 * estimate 1 and se 0.2, the rest are null.*/
	static Site[] tenSitesOneRegion() {
		Site[] s = new Site[10];
		for (int i=0; i< s.length; i++) {
			boolean inRegion = i >= 2 && i <= 5;
			s[i] = new Site("cg"+i, "1", 100 * (i+1), inRegion ? 1.0 : 0.01, inRegion ? 0.2 : 1.0);
		}
		return s;
	}

	/**Random sites over two chromosomes with a random measurement matrix, fixed seed.*/
	static Site[] randomSites(long seed, int number) {
		Random r = new Random(seed);
		Site[] s = new Site[number];
		int pos = 0;
		for (int i=0; i< number; i++) {
			String chr = i < number/2 ? "1" : "2";
			if (i == number/2) pos = 0;
			pos += 20 + r.nextInt(400);
			double se = 0.05 + r.nextDouble() * 0.1;
			double est = r.nextGaussian() * 0.2;
			s[i] = new Site("cg"+i, chr, pos, est, se);
		}
		return s;
	}

	static double[][] randomMatrix(long seed, int numberSites, int numberSamples) {
		Random r = new Random(seed);
		double[][] m = new double[numberSites][numberSamples];
		double[] shared = new double[numberSamples];
		for (int i=0; i< numberSites; i++) {
			for (int j=0; j< numberSamples; j++) {
				//neighbors share part of the signal
				shared[j] = 0.7 * shared[j] + r.nextGaussian();
				m[i][j] = shared[j] + 0.5 * r.nextGaussian();
			}
			if (i % 11 == 0) m[i][r.nextInt(numberSamples)] = Double.NaN;
		}
		return m;
	}
}
