package util.gen;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.FileOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**Static file and printing helpers.*/
public class IO {

	public static void pl(Object obj){
		System.out.println(obj.toString());
	}
	public static void pl(){
		System.out.println();
	}
	
	public static void el(Object obj){
		System.err.println(obj.toString());
	}

	/**Returns a gz zip or straight file reader on the file based on it's extension.
	 * @author davidnix*/
	public static BufferedReader fetchBufferedReader( File txtFile) throws IOException{
		BufferedReader in;
		String name = txtFile.getName().toLowerCase();
		if (name.endsWith(".zip")) {
			ZipFile zf = new ZipFile(txtFile);
			ZipEntry ze = (ZipEntry) zf.entries().nextElement();
			in = new BufferedReader(new InputStreamReader(zf.getInputStream(ze)));
		}
		else if (name.endsWith(".gz")) {
			in = new BufferedReader(new InputStreamReader(new GZIPInputStream(new FileInputStream(txtFile))));
		}
		else in = new BufferedReader (new FileReader (txtFile));
		return in;
	}

	/**Returns a gzipping writer if the file name ends with .gz, otherwise a plain one.*/
	public static PrintWriter fetchPrintWriter(File f) throws IOException{
		if (f.getName().toLowerCase().endsWith(".gz")) {
			return new PrintWriter(new OutputStreamWriter(new GZIPOutputStream(new FileOutputStream(f))));
		}
		return new PrintWriter(new FileWriter(f));
	}

	public static void closeNoException(BufferedReader in) {
		if (in == null) return;
		try {
			in.close();
		} catch (IOException e) {
			el("WARNING: failed to close reader, "+e.getMessage());
		}
	}
}
