package gov.nih.ncats.molgraph;

import java.io.IOException;
import java.util.Objects;

/**
 * Thrown when chemical text can not be turned into a structure
 * (or a structure can not be written out).
 *
 * The {@link Kind} tells callers whether there was nothing to parse,
 * whether the request is recognized but not handled, or whether the input
 * is malformed.
 */
public class ChemException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Kind{
        EMPTY_INPUT,
        UNSUPPORTED,
        PARSE_FAILED
    }

    private final Kind kind;
    private final String detail;

    private ChemException(Kind kind, String detail, String message){
        super(message);
        this.kind = Objects.requireNonNull(kind);
        this.detail = detail;
    }

    public static ChemException emptyInput(){
        return new ChemException(Kind.EMPTY_INPUT, null, "No input provided.");
    }

    public static ChemException unsupported(String what){
        return new ChemException(Kind.UNSUPPORTED, what, "Unsupported: " + what);
    }

    public static ChemException parseFailed(String what){
        return new ChemException(Kind.PARSE_FAILED, what, "Could not parse: " + what);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The description without the kind prefix; null for {@link Kind#EMPTY_INPUT}.
     * @return
     */
    public String getDetail() {
        return detail;
    }
}
