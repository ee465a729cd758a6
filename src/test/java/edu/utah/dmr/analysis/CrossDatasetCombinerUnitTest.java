package edu.utah.dmr.analysis;

import org.testng.Assert;
import org.testng.annotations.Test;

import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;

public class CrossDatasetCombinerUnitTest {

	private static PreparedDataset dataset(String name, Site[] sorted) {
		return PreparedDataset.fromSorted(name, sorted, new double[sorted.length][2], 2);
	}

	@Test
	public void testInverseVarianceWeight() {
		MetaStats ms = CrossDatasetCombiner.inverseVarianceWeight(new double[]{1, 3}, new double[]{1, 1});
		Assert.assertEquals(ms.getEstimate(), 2.0, 1e-15);
		Assert.assertEquals(ms.getVariance(), 0.5, 1e-15);

		//precise study dominates
		ms = CrossDatasetCombiner.inverseVarianceWeight(new double[]{0, 1}, new double[]{1, 0.25});
		Assert.assertEquals(ms.getEstimate(), 0.8, 1e-15);
		Assert.assertEquals(ms.getVariance(), 0.2, 1e-15);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testOneDataset() {
		CrossDatasetCombiner.checkDatasets(new PreparedDataset[]{dataset("a", new Site[]{new Site("x", "1", 1, 0.1, 0.1)})});
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testNoDatasets() {
		CrossDatasetCombiner.checkDatasets(null);
	}

	@Test
	public void testSharedSites() {
		PreparedDataset a = dataset("a", new Site[]{
				new Site("cg1", "1", 100, 0.2, 0.1),
				new Site("cg2", "1", 200, 0.4, 0.1),
				new Site("cg3", "1", 300, 0.6, 0.1),
				new Site("cg4", "2", 50, 0.8, 0.1)});
		//different coordinates for cg2, cg3 missing, extra cg9
		PreparedDataset b = dataset("b", new Site[]{
				new Site("cg1", "1", 100, 0.4, 0.1),
				new Site("cg2", "1", 210, 0.4, 0.2),
				new Site("cg9", "1", 250, 1.0, 0.1),
				new Site("cg4", "2", 50, -0.8, 0.1)});

		SiteTable combined = CrossDatasetCombiner.combineSites(new PreparedDataset[]{a, b});
		Assert.assertEquals(combined.size(), 3);
		Assert.assertFalse(combined.contains("cg3"));
		Assert.assertFalse(combined.contains("cg9"));

		Site s1 = combined.get(0);
		Assert.assertEquals(s1.getId(), "cg1");
		Assert.assertEquals(s1.getEstimate(), 0.3, 1e-12);
		Assert.assertEquals(s1.getSe(), Math.sqrt(0.005), 1e-12);

		Site s2 = combined.get(combined.indexOf("cg2"));
		Assert.assertEquals(s2.getPosition(), 200);
		Assert.assertEquals(s2.getEstimate(), 0.4, 1e-12);

		Site s4 = combined.get(2);
		Assert.assertEquals(s4.getId(), "cg4");
		Assert.assertEquals(s4.getChromosome(), "2");
		Assert.assertEquals(s4.getEstimate(), 0.0, 1e-12);
		Assert.assertEquals(s4.getPValue(), 1.0, 1e-12);
	}

	@Test
	public void testNothingShared() {
		PreparedDataset a = dataset("a", new Site[]{new Site("cg1", "1", 100, 0.2, 0.1)});
		PreparedDataset b = dataset("b", new Site[]{new Site("cg2", "1", 100, 0.2, 0.1)});
		Assert.assertEquals(CrossDatasetCombiner.combineSites(new PreparedDataset[]{a, b}).size(), 0);
	}
}
