package com.acme.hotdog.router.transport;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LineBasedFrameDecoder;

import java.util.List;

/**
 * Line framing that also emits the unterminated tail of the stream when the
 * peer closes, so the last line of a connection is routed like the others.
 */
final class SyslogLineDecoder extends LineBasedFrameDecoder {

    SyslogLineDecoder(int maxLineBytes) {
        super(maxLineBytes);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        // bytes over the limit were already discarded by decode, what is left fits
        if (in.isReadable()) {
            out.add(in.readRetainedSlice(in.readableBytes()));
        }
    }
}
