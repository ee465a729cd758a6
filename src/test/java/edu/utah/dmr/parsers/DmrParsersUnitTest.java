package edu.utah.dmr.parsers;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;

import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;
import util.gen.IO;

public class DmrParsersUnitTest {

	private File tempDir;

	@BeforeClass
	public void makeTempDir() throws IOException {
		tempDir = Files.createTempDirectory("dmrParsers").toFile();
	}

	@AfterClass
	public void deleteTempDir() {
		File[] files = tempDir.listFiles();
		if (files != null) for (File f: files) f.delete();
		tempDir.delete();
	}

	private File write(String name, String... lines) throws IOException {
		File f = new File(tempDir, name);
		PrintWriter out = IO.fetchPrintWriter(f);
		for (String l: lines) out.println(l);
		out.close();
		return f;
	}

	private static ArrayList<String> read(File f) throws IOException {
		ArrayList<String> lines = new ArrayList<String>();
		BufferedReader in = IO.fetchBufferedReader(f);
		String line;
		while ((line = in.readLine()) != null) lines.add(line);
		in.close();
		return lines;
	}

	@Test
	public void testParseSites() throws IOException {
		File f = write("sites.txt",
				"# some comment",
				"id\tchr\tpos\testimate\tse\tp",
				"cg2\tchr1\t200\t0.5\t0.1\t0.001",
				"cg1\tchr1\t100\t-0.2\t0.1\tNA",
				"",
				"cg3\tchr2\t50\t0.1\t0.2");
		Site[] s = SiteTableParser.parse(f);
		Assert.assertEquals(s.length, 3);
		Assert.assertEquals(s[0].getId(), "cg2");
		Assert.assertEquals(s[0].getPValue(), 0.001);
		Assert.assertEquals(s[1].getChromosome(), "chr1");
		Assert.assertEquals(s[1].getPosition(), 100);
		Assert.assertEquals(s[1].getEstimate(), -0.2);
		//derived from estimate and se
		Assert.assertEquals(s[1].getPValue(), 0.0455, 1e-4);
		Assert.assertEquals(s[2].getSe(), 0.2);
	}

	@Test
	public void testParseGzippedSites() throws IOException {
		File f = write("sites.txt.gz", "cg1\t1\t100\t0.3\t0.1");
		Site[] s = SiteTableParser.parse(f);
		Assert.assertEquals(s.length, 1);
		Assert.assertEquals(s[0].getEstimate(), 0.3);
	}

	@Test(expectedExceptions = IOException.class)
	public void testBadStandardError() throws IOException {
		SiteTableParser.parse(write("badSe.txt", "cg1\t1\t100\t0.3\t0"));
	}

	@Test(expectedExceptions = IOException.class)
	public void testTooFewColumns() throws IOException {
		SiteTableParser.parse(write("short.txt", "cg1\t1\t100\t0.3"));
	}

	@Test
	public void testParseMatrix() throws IOException {
		Site[] sites = {new Site("cg1", "1", 100, 0.1, 0.1), new Site("cg2", "1", 200, 0.1, 0.1)};
		File f = write("matrix.txt",
				"id\tsampleA\tsampleB\tsampleC",
				"cg2\t0.4\tNA\t0.6",
				"cg1\t0.1\t0.2\t0.3",
				"cg9\t0.9\t0.9\t0.9");
		double[][] m = MeasurementMatrixParser.parse(f, sites);
		Assert.assertEquals(m.length, 2);
		Assert.assertEquals(m[0], new double[]{0.1, 0.2, 0.3});
		Assert.assertEquals(m[1][0], 0.4);
		Assert.assertTrue(Double.isNaN(m[1][1]));
	}

	@Test(expectedExceptions = IOException.class)
	public void testMatrixMissingSite() throws IOException {
		Site[] sites = {new Site("cg1", "1", 100, 0.1, 0.1), new Site("cg2", "1", 200, 0.1, 0.1)};
		MeasurementMatrixParser.parse(write("missing.txt", "cg1\t0.1\t0.2\t0.3"), sites);
	}

	@Test(expectedExceptions = IOException.class)
	public void testMatrixDuplicateId() throws IOException {
		Site[] sites = {new Site("cg1", "1", 100, 0.1, 0.1)};
		MeasurementMatrixParser.parse(write("dup.txt", "cg1\t0.1\t0.2\t0.3", "cg1\t0.1\t0.2\t0.3"), sites);
	}

	@Test(expectedExceptions = IOException.class)
	public void testMatrixRaggedRows() throws IOException {
		Site[] sites = {new Site("cg1", "1", 100, 0.1, 0.1), new Site("cg2", "1", 200, 0.1, 0.1)};
		MeasurementMatrixParser.parse(write("ragged.txt", "cg1\t0.1\t0.2\t0.3", "cg2\t0.1\t0.2"), sites);
	}

	@Test
	public void testWriteDmrsAndSites() throws IOException {
		DmrRecord d = new DmrRecord("chr1", 300, 600, 4, 1.0, 0.1, 10.0, 1e-23, 1.3e-22, 2, 5);
		File dmrFile = new File(tempDir, "dmrs.xls");
		DmrSpreadSheetWriter.writeDmrs(new DmrRecord[]{d}, dmrFile);
		ArrayList<String> lines = read(dmrFile);
		Assert.assertEquals(lines.size(), 2);
		Assert.assertEquals(lines.get(0), "#"+DmrRecord.HEADER);
		Assert.assertTrue(lines.get(1).startsWith("chr1\t300\t600\t4\t"));

		SiteTable sites = new SiteTable(new Site[]{new Site("cg2", "1", 200, 0.1, 0.1), new Site("cg1", "1", 100, 0.1, 0.1)});
		File siteFile = new File(tempDir, "sites.xls.gz");
		DmrSpreadSheetWriter.writeSites(sites, siteFile);
		lines = read(siteFile);
		Assert.assertEquals(lines.size(), 3);
		Assert.assertTrue(lines.get(1).startsWith("cg1\t1\t100\t"));
		Assert.assertTrue(lines.get(2).startsWith("cg2\t1\t200\t"));
	}
}
