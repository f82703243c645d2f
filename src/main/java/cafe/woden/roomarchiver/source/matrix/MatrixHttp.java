package cafe.woden.roomarchiver.source.matrix;

import cafe.woden.roomarchiver.net.HttpLite;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/** Transport used by {@link MatrixEventSource}. A blank access token sends no Authorization. */
public interface MatrixHttp {

  HttpLite.Response<String> get(URI uri, String accessToken) throws IOException;

  HttpLite.Response<String> post(URI uri, String accessToken, String jsonBody) throws IOException;

  HttpLite.Response<InputStream> getStream(URI uri, String accessToken) throws IOException;
}
