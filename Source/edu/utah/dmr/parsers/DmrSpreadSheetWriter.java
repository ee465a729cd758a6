package edu.utah.dmr.parsers;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;
import util.gen.IO;

/**Writes tab delimited, excel compatible spreadsheets of regions and combined sites.*/
public class DmrSpreadSheetWriter {

	public static void writeDmrs(DmrRecord[] dmrs, File file) throws IOException{
		PrintWriter out = IO.fetchPrintWriter(file);
		try {
			out.println("#"+DmrRecord.HEADER);
			for (DmrRecord d: dmrs) out.println(d.toString());
		} finally {
			out.close();
		}
		if (out.checkError()) throw new IOException("Problem writing "+file);
	}
	
	public static void writeSites(SiteTable sites, File file) throws IOException{
		PrintWriter out = IO.fetchPrintWriter(file);
		try {
			out.println("#Id\tChr\tPos\tEstimate\tSE\tZ\tPValue");
			for (int i=0; i< sites.size(); i++) {
				Site s = sites.get(i);
				out.println(s.toString());
			}
		} finally {
			out.close();
		}
		if (out.checkError()) throw new IOException("Problem writing "+file);
	}
}
