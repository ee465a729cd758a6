package edu.utah.dmr.analysis;

import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.MetaAnalysisResult;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.parsers.DmrSpreadSheetWriter;
import edu.utah.dmr.parsers.MeasurementMatrixParser;
import edu.utah.dmr.parsers.SiteTableParser;
import util.gen.IO;
import util.gen.Misc;

/**Application for calling differentially methylated regions from per site EWAS statistics, for one dataset
 * or a meta analysis of several.
 * @author Nix
 * */
public class DmrScanner {

	//fields
	private File[] siteFiles;
	private File[] matrixFiles;
	private File resultsFile;
	private DmrConfig config = new DmrConfig();
	private int numberDmrs = 0;
	private int numberSignificantDmrs = 0;

	//constructor
	public DmrScanner(String[] args){
		long startTime = System.currentTimeMillis();
		try {
			//set fields
			processArgs(args);

			//launch
			run();

		} catch (Exception e) {
			e.printStackTrace();
			Misc.printErrAndExit("\nProblem encountered, aborting!");
		}

		//finish and calc run time
		double diffTime = ((double)(System.currentTimeMillis() -startTime))/60000;
		IO.pl("\nDone! "+Math.round(diffTime)+" minutes\n");
	}

	public void run() throws Exception{
		//load datasets
		IO.pl("Loading and preparing datasets...");
		PreparedDataset[] datasets = new PreparedDataset[siteFiles.length];
		for (int i=0; i< siteFiles.length; i++){
			Site[] sites = SiteTableParser.parse(siteFiles[i]);
			double[][] matrix = MeasurementMatrixParser.parse(matrixFiles[i], sites);
			datasets[i] = DatasetPreparer.prepare(siteFiles[i].getName(), sites, matrix, config.getBandwidth());
			int numSamples = matrix.length == 0 ? 0 : matrix[0].length;
			IO.pl("\t"+siteFiles[i].getName()+"\t"+sites.length+" sites\t"+numSamples+" samples");
		}

		DmrRecord[] dmrs;
		if (datasets.length == 1){
			IO.pl("\nCalling regions...");
			dmrs = DmrFinder.findDmrs(datasets[0], config);
		}
		else {
			IO.pl("\nMeta analyzing "+datasets.length+" datasets and calling regions...");
			MetaAnalysisResult res = DmrMetaFinder.findDmrs(datasets, config);
			dmrs = res.getDmrs();
			File sitesFile = new File(resultsFile.getParentFile(), Misc.removeExtension(resultsFile.getName())+"_MetaSites.xls");
			DmrSpreadSheetWriter.writeSites(res.getCombinedSites(), sitesFile);
			IO.pl("\t"+res.getCombinedSites().size()+" shared sites written to "+sitesFile.getName());
		}

		//stats
		numberDmrs = dmrs.length;
		for (DmrRecord d: dmrs) if (d.getAdjustedPValue() < 0.05) numberSignificantDmrs++;
		IO.pl("\t"+numberDmrs+" candidate regions");
		IO.pl("\t"+numberSignificantDmrs+" with an adjusted p-value < 0.05");

		IO.pl("\nWriting "+resultsFile+"...");
		DmrSpreadSheetWriter.writeDmrs(dmrs, resultsFile);
	}

	public static void main(String[] args) {
		if (args.length ==0){
			printDocs();
			System.exit(0);
		}
		new DmrScanner(args);
	}

	/**This method will process each argument and assign new variables*/
	public void processArgs(String[] args){
		Pattern pat = Pattern.compile("-[a-z]");
		IO.pl("\nDmrScanner Arguments: "+Misc.stringArrayToString(args, " ")+"\n");
		String sites = null;
		String matrices = null;
		//all processors unless -t
		config.setNumberThreads(0);
		for (int i = 0; i<args.length; i++){
			String lcArg = args[i].toLowerCase();
			Matcher mat = pat.matcher(lcArg);
			if (mat.matches()){
				char test = args[i].charAt(1);
				try{
					switch (test){
					case 's': sites = args[++i]; break;
					case 'm': matrices = args[++i]; break;
					case 'r': resultsFile = new File(args[++i]); break;
					case 'g': config.setMaxGap(Integer.parseInt(args[++i])); break;
					case 'p': config.setPValueCutoff(Double.parseDouble(args[++i])); break;
					case 'w': config.setBandwidth(Integer.parseInt(args[++i])); break;
					case 't': config.setNumberThreads(Integer.parseInt(args[++i])); break;
					case 'h': printDocs(); System.exit(0);
					default: Misc.printErrAndExit("\nProblem, unknown option! " + mat.group());
					}
				}
				catch (Exception e){
					Misc.printErrAndExit("\nSorry, something doesn't look right with this parameter: -"+test+"\n");
				}
			}
		}

		//site and matrix files
		if (sites == null || matrices == null) Misc.printErrAndExit("\nError: please provide both site statistic (-s) and measurement matrix (-m) files.\n");
		siteFiles = fetchFiles(sites);
		matrixFiles = fetchFiles(matrices);
		if (siteFiles.length != matrixFiles.length) Misc.printErrAndExit("\nError: the number of site statistic files ("+siteFiles.length+") and matrix files ("+matrixFiles.length+") differ.\n");

		//results
		if (resultsFile == null) Misc.printErrAndExit("\nError: please provide a file for saving the regions, e.g. -r myDmrs.xls\n");
		File parent = resultsFile.getAbsoluteFile().getParentFile();
		if (parent.exists() == false) parent.mkdirs();
		resultsFile = resultsFile.getAbsoluteFile();

		//settings
		try {
			config.validate();
		} catch (IllegalArgumentException e){
			Misc.printErrAndExit("\nError: "+e.getMessage()+"\n");
		}
		config.setNumberThreads(config.fetchNumberThreads());
		printSettings();
	}

	private static File[] fetchFiles(String commaList){
		String[] names = Misc.COMMA.split(commaList);
		File[] f = new File[names.length];
		for (int i=0; i< names.length; i++){
			f[i] = new File(names[i]);
			if (f[i].canRead() == false) Misc.printErrAndExit("\nError: cannot read "+f[i]+"\n");
		}
		return f;
	}

	public void printSettings(){
		IO.pl("Settings:");
		for (File f: siteFiles) IO.pl(f+"\tSite statistics");
		for (File f: matrixFiles) IO.pl(f+"\tMeasurement matrix");
		IO.pl(resultsFile+"\tResults");
		IO.pl(config.toString());
		IO.pl();
	}

	public static void printDocs(){
		IO.pl("\n" +
				"**************************************************************************************\n" +
				"**                               DMR Scanner: Oct 2026                              **\n" +
				"**************************************************************************************\n" +
				"Identifies differentially methylated regions, runs of neighboring CpG sites whose EWAS\n" +
				"statistics are each only modestly significant but jointly point to a region level\n" +
				"effect. Candidates are runs of sites with p < the cutoff, the same effect direction,\n" +
				"and <= max gap bp apart. Each candidate is shrunk to the sub span with the strongest\n" +
				"combined z-score using a fixed effect meta analysis that accounts for the correlation\n" +
				"between neighboring sites, estimated from the measurement matrix. P-values are\n" +
				"Bonferroni corrected for every site and every sub span tested. Provide several\n" +
				"comma delimited site and matrix files to meta analyze independent datasets.\n"+

				"\nRequired Options:\n"+
				"-s Tab delimited site statistics file(s): id, chr, pos, estimate, se, optional p.\n"+
				"      Comma delimit several for a meta analysis. Zip and gz are OK.\n"+
				"-m Tab delimited measurement matrix file(s), one per -s file, in the same order: id\n"+
				"      followed by one value per sample, NA for missing.\n"+
				"-r Results spreadsheet to write, e.g. ~/EWAS/dmrs.xls\n"+

				"\nAdvanced Options:\n"+
				"-g Maximum gap in bp between consecutive sites in a region, defaults to 500.\n"+
				"-p Site p-value cutoff for candidate membership, defaults to 0.05.\n"+
				"-w Correlation bandwidth, number of downstream neighbors to correlate each site with,\n"+
				"      defaults to 20. Regions with more than this + 1 sites get a null score.\n"+
				"-t Number of threads, defaults to all available.\n" +

				"\n"+

				"Example: java -Xmx4G -jar pathTo/dmr-scan.jar -s ~/EWAS/stats.txt.gz\n" +
				"     -m ~/EWAS/betas.txt.gz -r ~/EWAS/dmrs.xls -g 1000 -t 8\n\n" +

		"**************************************************************************************\n");
	}

	public int getNumberDmrs() {
		return numberDmrs;
	}
}
