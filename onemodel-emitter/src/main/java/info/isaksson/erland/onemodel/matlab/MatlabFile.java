package info.isaksson.erland.onemodel.matlab;

/** A generated file: name relative to the output directory and full text. */
public record MatlabFile(String fileName, String content) {
}
