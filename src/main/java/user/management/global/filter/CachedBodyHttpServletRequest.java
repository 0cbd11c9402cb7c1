package user.management.global.filter;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 요청 본문을 미리 읽어 메모리에 보관하는 래퍼
 *
 * <p>{@link #getInputStream()}/{@link #getReader()}는 호출될 때마다 처음부터 다시 읽을 수 있는 스트림을 반환합니다. 필터가 본문을
 * 로그로 남긴 뒤에도 컨트롤러가 같은 본문을 바인딩할 수 있습니다.
 *
 * <p>form-urlencoded 파라미터는 원본 스트림에서 파싱되므로 지원하지 않습니다 (JSON API 전용).
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

  private final byte[] cachedBody;

  public CachedBodyHttpServletRequest(HttpServletRequest request) throws IOException {
    super(request);
    this.cachedBody = request.getInputStream().readAllBytes();
  }

  public String getBodyAsString() {
    return new String(cachedBody, resolveCharset());
  }

  @Override
  public ServletInputStream getInputStream() {
    return new CachedBodyServletInputStream(cachedBody);
  }

  @Override
  public BufferedReader getReader() {
    return new BufferedReader(
        new InputStreamReader(new ByteArrayInputStream(cachedBody), resolveCharset()));
  }

  /** 클라이언트가 보낸 charset이 없거나 알 수 없으면 UTF-8 */
  private Charset resolveCharset() {
    String encoding = getCharacterEncoding();
    if (encoding == null) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(encoding);
    } catch (IllegalArgumentException e) {
      // UnsupportedCharsetException, IllegalCharsetNameException
      return StandardCharsets.UTF_8;
    }
  }

  private static class CachedBodyServletInputStream extends ServletInputStream {

    private final ByteArrayInputStream delegate;

    CachedBodyServletInputStream(byte[] body) {
      this.delegate = new ByteArrayInputStream(body);
    }

    @Override
    public boolean isFinished() {
      return delegate.available() == 0;
    }

    @Override
    public boolean isReady() {
      return true;
    }

    @Override
    public void setReadListener(ReadListener readListener) {
      throw new UnsupportedOperationException("Async read is not supported");
    }

    @Override
    public int read() {
      return delegate.read();
    }

    @Override
    public int read(byte[] b, int off, int len) {
      return delegate.read(b, off, len);
    }
  }
}
