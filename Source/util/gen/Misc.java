package util.gen;

import java.util.regex.Pattern;

/**
 * A variety of static methods.
 *
 */
public class Misc {
	
	public static final Pattern TAB = Pattern.compile("\t");
	public static final Pattern COMMA = Pattern.compile(",");

	/**Prints message to screen, then exits.*/
	public static void printErrAndExit (String message){
		System.err.println (message);
		System.exit(1);
	}

	/**Removes the text after the last period, also strips .gz and .zip.*/
	public static String removeExtension(String txt) {
		txt = txt.replaceAll("\\.gz", "");
		txt = txt.replaceAll("\\.zip", "");
		int index = txt.lastIndexOf(".");
		if (index != -1)  return txt.substring(0,index);
		return txt;
	}

	public static String stringArrayToString(String[] s, String separator){
		if (s==null) return "";
		int len = s.length;
		if (len==1) return s[0];
		if (len==0) return "";
		StringBuilder sb = new StringBuilder(s[0]);
		for (int i=1; i<len; i++){
			sb.append(separator);
			sb.append(s[i]);
		}
		return sb.toString();
	}

	/**Returns true if the value is one of the usual missing value markers, NA, NaN, '.' or blank.*/
	public static boolean isMissing(String value){
		if (value == null) return true;
		String v = value.trim();
		return v.length() == 0 || v.equals("NA") || v.equals("NaN") || v.equals(".");
	}
}
