/**
 * SpectraFit
 * ReportWriter.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.report;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of a {@link FitReport}. NaN and infinities are written as the
 * strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"} and read
 * back as the IEEE values.
 */
public class ReportWriter {

	private final ObjectMapper mapper;

	public ReportWriter() {
		mapper = new ObjectMapper();
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		mapper.configure(JsonGenerator.Feature.QUOTE_NON_NUMERIC_NUMBERS, true);
		mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
		mapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
	}

	public String toJson(final FitReport report) throws IOException {
		return mapper.writeValueAsString(report);
	}

	public void write(final FitReport report, final Writer out)
		throws IOException
	{
		mapper.writeValue(out, report);
	}

	public FitReport fromJson(final String json) throws IOException {
		return mapper.readValue(json, FitReport.class);
	}

	public FitReport read(final Reader in) throws IOException {
		return mapper.readValue(in, FitReport.class);
	}
}
