package edu.utah.dmr.parsers;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;

import edu.utah.dmr.data.Site;
import util.gen.IO;
import util.gen.Misc;
import util.gen.Num;

/**Parses a tab delimited measurement matrix, site id followed by one value per sample, NA for missing.  
 * A leading line of sample names or lines starting with # are skipped.  Rows are returned in the order of
 * the sites they're matched to by id.*/
public class MeasurementMatrixParser {
	
	/**@throws IOException if a row is malformed, an id repeats, rows differ in length, or a site has no row*/
	public static double[][] parse(File file, Site[] sites) throws IOException{
		HashMap<String, double[]> idRow = new HashMap<String, double[]>();
		BufferedReader in = null;
		int numberSamples = -1;
		try {
			in = IO.fetchBufferedReader(file);
			String line;
			int lineNumber = 0;
			while ((line = in.readLine()) != null){
				lineNumber++;
				if (line.trim().length() == 0 || line.startsWith("#")) continue;
				String[] f = Misc.TAB.split(line.trim());
				if (f.length < 2) throw new IOException("Too few columns on line "+lineNumber+" in "+file+" -> "+line);
				//sample name header?
				if (idRow.size() == 0 && numberSamples == -1 && isHeader(f)) {
					numberSamples = f.length - 1;
					continue;
				}
				if (numberSamples == -1) numberSamples = f.length - 1;
				if (f.length - 1 != numberSamples) throw new IOException("Expecting "+numberSamples+" samples, found "+(f.length-1)+" on line "+lineNumber+" in "+file);
				double[] row = new double[numberSamples];
				try {
					for (int i=0; i< numberSamples; i++) row[i] = Num.parseDoubleNA(f[i+1]);
				} catch (NumberFormatException e){
					throw new IOException("Failed to parse a value on line "+lineNumber+" in "+file+" -> "+line, e);
				}
				if (idRow.put(f[0], row) != null) throw new IOException("Duplicate site id '"+f[0]+"' on line "+lineNumber+" in "+file);
			}
		} finally {
			IO.closeNoException(in);
		}
		
		//align to the sites
		double[][] matrix = new double[sites.length][];
		for (int i=0; i< sites.length; i++){
			matrix[i] = idRow.get(sites[i].getId());
			if (matrix[i] == null) throw new IOException("Dimension mismatch: no measurements for site '"+sites[i].getId()+"' in "+file);
		}
		if (idRow.size() != sites.length) IO.el("WARNING: "+(idRow.size() - sites.length)+" matrix rows in "+file.getName()+" have no matching site and were ignored");
		return matrix;
	}
	
	private static boolean isHeader(String[] fields){
		for (int i=1; i< fields.length; i++){
			if (Misc.isMissing(fields[i])) continue;
			try {
				Double.parseDouble(fields[i]);
			} catch (NumberFormatException e){
				return true;
			}
		}
		return false;
	}
}
