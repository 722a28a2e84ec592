package hypertag.runtime;

import java.util.List;
import java.util.Map;

import hypertag.common.exceptions.UserException;

/**
 * A callable value of the template language, e.g. a builtin function.
 */
public interface HypertagFunction {
  public Object call(List<Object> args, Map<String, Object> kwargs)
                                                    throws UserException;
}
