package edu.utah.dmr.parsers;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;

import edu.utah.dmr.data.Site;
import util.gen.IO;
import util.gen.Misc;
import util.gen.Num;

/**Parses a tab delimited site statistics file: id, chromosome, position, estimate, standard error and an 
 * optional p-value.  Lines starting with # and a leading header line are skipped.  Zip and gz are OK.*/
public class SiteTableParser {
	
	public static Site[] parse(File file) throws IOException{
		BufferedReader in = null;
		ArrayList<Site> sites = new ArrayList<Site>();
		try {
			in = IO.fetchBufferedReader(file);
			String line;
			int lineNumber = 0;
			while ((line = in.readLine()) != null){
				lineNumber++;
				line = line.trim();
				if (line.length() == 0 || line.startsWith("#")) continue;
				String[] f = Misc.TAB.split(line);
				//header?
				if (sites.size() == 0 && isHeader(f)) continue;
				if (f.length < 5) throw new IOException("Too few columns, expecting id chr pos estimate se [p], on line "+lineNumber+" in "+file+" -> "+line);
				try {
					double p = Double.NaN;
					if (f.length > 5) p = Num.parseDoubleNA(f[5]);
					sites.add(new Site(f[0], f[1], Integer.parseInt(f[2]), Double.parseDouble(f[3]), Double.parseDouble(f[4]), p));
				} catch (IllegalArgumentException e){
					throw new IOException("Failed to parse line "+lineNumber+" in "+file+" -> "+line, e);
				}
			}
		} finally {
			IO.closeNoException(in);
		}
		Site[] s = new Site[sites.size()];
		sites.toArray(s);
		return s;
	}
	
	private static boolean isHeader(String[] fields){
		if (fields.length < 3) return false;
		try {
			Integer.parseInt(fields[2]);
			return false;
		} catch (NumberFormatException e){
			return true;
		}
	}
}
