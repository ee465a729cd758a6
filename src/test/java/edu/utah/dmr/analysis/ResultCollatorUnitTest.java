package edu.utah.dmr.analysis;

import org.testng.Assert;
import org.testng.annotations.Test;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.ShrunkRegion;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;
import util.gen.Num;

public class ResultCollatorUnitTest {

	@Test
	public void testBonferroni() {
		Assert.assertEquals(ResultCollator.bonferroni(0.001, 20), 0.02, 1e-15);
		Assert.assertEquals(ResultCollator.bonferroni(0.2, 20), 1.0);
		Assert.assertEquals(ResultCollator.bonferroni(1.0, 1), 1.0);
		Assert.assertEquals(ResultCollator.bonferroni(0, 100), 0.0);
		Assert.assertEquals(ResultCollator.bonferroni(1e-300, 1000000000L), 1e-291, 1e-300);
	}

	@Test
	public void testCountTests() {
		ShrunkRegion[] shrunk = {
				new ShrunkRegion(0, 0, 0, Double.NaN, 0, 0),
				new ShrunkRegion(1, 2, 4, 3.1, 5, 1),
				new ShrunkRegion(2, 7, 8, -2.5, 3, 0)};
		Assert.assertEquals(ResultCollator.countTests(10, shrunk), 18L);
		Assert.assertEquals(ResultCollator.countTests(10, new ShrunkRegion[0]), 10L);
	}

	@Test
	public void testCollate() {
		Site[] s = new Site[6];
		for (int i=0; i< s.length; i++) s[i] = new Site("cg"+i, i < 4 ? "chr1" : "chr2", 1000 + 50 * i, 0.1, 0.05);
		SiteTable sites = new SiteTable(s);
		ShrunkRegion[] shrunk = {
				new ShrunkRegion(0, 1, 3, 4.0, 5, 1),
				new ShrunkRegion(1, 5, 5, Double.NaN, 0, 0)};
		MetaStats[] stats = {new MetaStats(0.2, 0.0025), new MetaStats(-0.1, 0.01)};

		DmrRecord[] dmrs = ResultCollator.collate(sites, shrunk, stats);
		Assert.assertEquals(dmrs.length, 2);
		long tests = 6 + 5;

		DmrRecord a = dmrs[0];
		Assert.assertEquals(a.getChromosome(), "chr1");
		Assert.assertEquals(a.getStart(), 1050);
		Assert.assertEquals(a.getEnd(), 1150);
		Assert.assertEquals(a.getNumberSites(), 3);
		Assert.assertEquals(a.getEstimate(), 0.2, 1e-15);
		Assert.assertEquals(a.getSe(), 0.05, 1e-15);
		Assert.assertEquals(a.getZ(), 4.0, 1e-12);
		Assert.assertEquals(a.getPValue(), Num.twoSidedPValue(4.0), 1e-15);
		Assert.assertEquals(a.getAdjustedPValue(), a.getPValue() * tests, 1e-15);
		Assert.assertEquals(a.getStartIndex(), 1);
		Assert.assertEquals(a.getEndIndex(), 3);

		DmrRecord b = dmrs[1];
		Assert.assertEquals(b.getChromosome(), "chr2");
		Assert.assertEquals(b.getStart(), 1250);
		Assert.assertEquals(b.getEnd(), 1250);
		Assert.assertEquals(b.getNumberSites(), 1);
		Assert.assertEquals(b.getZ(), -1.0, 1e-12);
		Assert.assertTrue(b.getAdjustedPValue() >= b.getPValue());
		Assert.assertTrue(b.getAdjustedPValue() <= 1.0);

		Site[] regionSites = ResultCollator.fetchSites(a, sites);
		Assert.assertEquals(regionSites.length, 3);
		Assert.assertEquals(regionSites[0].getId(), "cg1");
		Assert.assertEquals(regionSites[2].getId(), "cg3");
	}

	@Test
	public void testNullStatsGiveUnitPValue() {
		SiteTable sites = new SiteTable(new Site[]{new Site("a", "1", 1, 0.3, 0.1), new Site("b", "1", 2, 0.3, 0.1)});
		DmrRecord[] dmrs = ResultCollator.collate(sites, new ShrunkRegion[]{new ShrunkRegion(0, 0, 1, 0, 3, 0)}, new MetaStats[]{new MetaStats(0, 1)});
		Assert.assertEquals(dmrs[0].getZ(), 0.0);
		Assert.assertEquals(dmrs[0].getPValue(), 1.0, 1e-12);
		Assert.assertEquals(dmrs[0].getAdjustedPValue(), 1.0);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testMismatchedStats() {
		SiteTable sites = new SiteTable(new Site[]{new Site("a", "1", 1, 0.3, 0.1)});
		ResultCollator.collate(sites, new ShrunkRegion[]{new ShrunkRegion(0, 0, 0, Double.NaN, 0, 0)}, new MetaStats[0]);
	}
}
