package io.chronofmt.processor;

import io.chronofmt.InvalidFormatDescriptionException;
import io.chronofmt.parser.Parser;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.tools.Diagnostic;

/**
 * Compiles every {@code @FormatDescriptionConstant} field while {@code javac} runs.
 *
 * <p>The field must be a {@code static final String} with a constant initializer. An invalid
 * description is reported as a compiler error on the field. Enable it with {@code -processor
 * io.chronofmt.processor.FormatDescriptionProcessor}.
 */
@SupportedAnnotationTypes(FormatDescriptionProcessor.ANNOTATION)
public final class FormatDescriptionProcessor extends AbstractProcessor {
  static final String ANNOTATION = "io.chronofmt.FormatDescriptionConstant";

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    for (TypeElement annotation : annotations) {
      for (Element element : roundEnv.getElementsAnnotatedWith(annotation)) {
        check(element);
      }
    }
    return true;
  }

  private void check(Element element) {
    if (element.getKind() != ElementKind.FIELD
        || !element.getModifiers().contains(Modifier.STATIC)
        || !element.getModifiers().contains(Modifier.FINAL)) {
      error(element, "@FormatDescriptionConstant needs a static final String field");
      return;
    }
    Object value = ((VariableElement) element).getConstantValue();
    if (!(value instanceof String description)) {
      error(element, "@FormatDescriptionConstant needs a String constant initializer");
      return;
    }
    int version = version(element);
    if (version != 1 && version != 2) {
      error(element, "format description version must be 1 or 2, not " + version);
      return;
    }
    try {
      Parser.compile(description, version);
    } catch (InvalidFormatDescriptionException e) {
      error(element, e.displayRich());
    }
  }

  private int version(Element element) {
    return element.getAnnotationMirrors().stream()
        .filter(m -> m.getAnnotationType().toString().equals(ANNOTATION))
        .flatMap(m -> m.getElementValues().entrySet().stream())
        .filter(e -> e.getKey().getSimpleName().contentEquals("version"))
        .map(e -> (Integer) e.getValue().getValue())
        .findFirst()
        .orElse(1);
  }

  private void error(Element element, String message) {
    processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
  }
}
